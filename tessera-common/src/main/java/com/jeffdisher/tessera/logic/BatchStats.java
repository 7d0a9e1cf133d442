package com.jeffdisher.tessera.logic;


/**
 * Reports what one optimization run did to a batch.
 */
public record BatchStats(int originalCount
		, int optimizedCount
		, int patchesMerged
		, int patchesEliminated
)
{
	/**
	 * @return The fraction of patches removed, in [0.0, 1.0] (0.0 for an empty batch).
	 */
	public double optimizationRatio()
	{
		return (0 == this.originalCount)
				? 0.0
				: (1.0 - ((double)this.optimizedCount / (double)this.originalCount))
		;
	}
}
