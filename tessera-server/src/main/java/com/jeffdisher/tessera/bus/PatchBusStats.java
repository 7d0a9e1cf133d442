package com.jeffdisher.tessera.bus;


/**
 * A consistent copy of the bus counters.
 */
public record PatchBusStats(long submitted
		, long committed
		, long rolledBack
		, long rejected
		, long expired
		, long patchesApplied
		, int patchesThisFrame
		, int peakPending
		, int pending
		, int commitLogSize
)
{
}
