package com.jeffdisher.tessera.server;

import java.io.PrintStream;
import java.util.List;

import com.jeffdisher.tessera.kernel.ApplyResult;
import com.jeffdisher.tessera.kernel.KernelStats;


/**
 * Published to the MonitoringAgent at the end of every frame.
 */
public record FrameReport(long frame
		, float deltaTime
		, List<ApplyResult> results
		, KernelStats stats
		, long millisInFrame
)
{
	public int failedCount()
	{
		int failed = 0;
		for (ApplyResult result : this.results)
		{
			if (!result.success())
			{
				failed += 1;
			}
		}
		return failed;
	}

	public void writeToStream(PrintStream out)
	{
		out.printf("Frame %d processed in %d ms (delta %.3f s):\n", this.frame, this.millisInFrame, this.deltaTime);
		out.println("\tTransactions applied: " + this.results.size() + " (" + failedCount() + " rolled back)");
		out.println("\tBus: submitted " + this.stats.bus().submitted()
				+ ", committed " + this.stats.bus().committed()
				+ ", rolled back " + this.stats.bus().rolledBack()
				+ ", rejected " + this.stats.bus().rejected()
				+ ", expired " + this.stats.bus().expired()
				+ ", pending " + this.stats.bus().pending()
		);
		out.println("\tConflicts: " + this.stats.conflicts() + " (" + this.stats.deferred() + " deferred)");
		out.println("\tNamespaces: " + this.stats.namespaceCount());
		out.println("\tEntities: " + this.stats.entityCount());
		out.println("\tLayers: " + this.stats.layerCount());
		out.println("\tAssets: " + this.stats.assetCount());
		out.println("\tSnapshots: " + this.stats.snapshotCount() + " (" + this.stats.snapshotMemory() + " bytes)");
	}
}
