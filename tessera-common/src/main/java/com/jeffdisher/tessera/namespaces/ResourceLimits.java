package com.jeffdisher.tessera.namespaces;


/**
 * Per-namespace quotas, enforced when transactions are submitted.  A limit of 0 means "unlimited".
 */
public record ResourceLimits(int maxEntities
		, int maxLayers
		, int maxAssets
		, int maxPatchesPerFrame
		, int maxPendingTransactions
)
{
	public static final ResourceLimits UNLIMITED = new ResourceLimits(0, 0, 0, 0, 0);
	public static final ResourceLimits DEFAULT_APP = new ResourceLimits(10_000, 32, 1_000, 10_000, 100);

	/**
	 * @param limit A limit from this record.
	 * @param projected The count which would exist if the operation were allowed.
	 * @return True if projected is within the limit.
	 */
	public static boolean within(int limit, int projected)
	{
		return (0 == limit) || (projected <= limit);
	}
}
