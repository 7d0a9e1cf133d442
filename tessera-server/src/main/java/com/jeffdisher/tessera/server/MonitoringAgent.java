package com.jeffdisher.tessera.server;

import com.jeffdisher.tessera.kernel.Kernel;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.SnapshotId;
import com.jeffdisher.tessera.utils.Assert;


/**
 * Used by ConsoleHandler to read out the state of the system for informational commands.
 * Note that these calls to read or change state can come in from any thread so care must be taken to avoid concurrent
 * modifications or other racy errors.  The kernel reference is only used for its thread-safe registries (namespaces,
 * snapshots).
 */
public class MonitoringAgent
{
	private volatile Kernel _kernel;
	private volatile FrameReport _lastReport;
	private volatile OperatorCommandSink _commandSink;

	public void setKernel(Kernel kernel)
	{
		// This should only be called once.
		Assert.assertTrue(null == _kernel);
		_kernel = kernel;
	}

	public Kernel getKernel()
	{
		return _kernel;
	}

	public synchronized void framePublished(FrameReport report)
	{
		_lastReport = report;
		this.notifyAll();
	}

	public FrameReport getLastReport()
	{
		return _lastReport;
	}

	/**
	 * Blocks until a report for at least the given frame has been published.
	 *
	 * @param frame The frame number to wait for.
	 * @return The most recent report (its frame is >= the requested frame).
	 */
	public synchronized FrameReport waitForFrame(long frame)
	{
		while ((null == _lastReport) || (_lastReport.frame() < frame))
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
		return _lastReport;
	}

	public void setOperatorCommandSink(OperatorCommandSink sink)
	{
		_commandSink = sink;
	}

	public OperatorCommandSink getCommandSink()
	{
		return _commandSink;
	}


	/**
	 * Requests made by the operator.  Each is executed asynchronously on the kernel thread, reporting its outcome to
	 * stdout.
	 */
	public static interface OperatorCommandSink
	{
		void requestSnapshot();
		void requestRollback(SnapshotId snapshotId);
		void requestDestroyNamespace(NamespaceId namespace);
		void pauseFrameProcessing();
		void resumeFrameProcessing();
	}
}
