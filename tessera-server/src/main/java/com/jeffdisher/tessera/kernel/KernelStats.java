package com.jeffdisher.tessera.kernel;

import com.jeffdisher.tessera.bus.PatchBusStats;


/**
 * A point-in-time summary of the kernel, for monitoring.
 */
public record KernelStats(long frame
		, PatchBusStats bus
		, long conflicts
		, long deferred
		, int namespaceCount
		, int entityCount
		, int layerCount
		, int assetCount
		, int snapshotCount
		, long snapshotMemory
)
{
}
