package com.jeffdisher.tessera.integration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.function.LongSupplier;

import com.jeffdisher.tessera.bus.NamespaceHandle;
import com.jeffdisher.tessera.config.KernelConfig;
import com.jeffdisher.tessera.kernel.ApplyResult;
import com.jeffdisher.tessera.kernel.FrameContext;
import com.jeffdisher.tessera.kernel.Kernel;
import com.jeffdisher.tessera.namespaces.ResourceLimits;
import com.jeffdisher.tessera.server.KernelRunner;
import com.jeffdisher.tessera.server.MonitoringAgent;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.utils.Assert;
import com.jeffdisher.tessera.world.ArenaWorld;
import com.jeffdisher.tessera.world.IWorld;


/**
 * Embeds a running kernel for applications which want to drive it in-process.
 * Everything which needs the kernel or the world is ferried over to the kernel thread and the calling thread is
 * blocked until it completes, so callers see a simple synchronous interface while the frame loop keeps running on its
 * own schedule.
 */
public class LocalKernelShim
{
	/**
	 * Creates a shim with a started KernelRunner over an empty world.
	 * 
	 * @param config The kernel config.
	 * @param currentTimeMillisProvider The provider of current time in millis.
	 * @return The shim.
	 */
	public static LocalKernelShim startedKernelShim(KernelConfig config, LongSupplier currentTimeMillisProvider)
	{
		return new LocalKernelShim(config, currentTimeMillisProvider);
	}


	private final Kernel _kernel;
	private final MonitoringAgent _monitoringAgent;
	private final KernelRunner _runner;
	private final List<ApplyResult> _results;
	private long _lastFrame;

	private LocalKernelShim(KernelConfig config, LongSupplier currentTimeMillisProvider)
	{
		// Private since we want to use the factory.
		_kernel = new Kernel(config, currentTimeMillisProvider);
		_monitoringAgent = new MonitoringAgent();
		_results = new ArrayList<>();
		_runner = new KernelRunner(config.millisPerFrame
				, _kernel
				, new ArenaWorld()
				, currentTimeMillisProvider
				, _monitoringAgent
				, (FrameContext context, List<ApplyResult> results) -> _frameCompleted(context, results)
		);
	}

	/**
	 * Registers a new application namespace and opens a handle into it.
	 * 
	 * @param name The namespace name.
	 * @param limits Its resource limits.
	 * @return The handle (safe to use from any thread).
	 */
	public NamespaceHandle registerApplication(String name, ResourceLimits limits)
	{
		return query((Kernel kernel, IWorld world) -> {
			NamespaceId id = kernel.registerNamespace(name, limits);
			return kernel.createHandle(id);
		});
	}

	/**
	 * Runs the given query on the kernel thread, between frames, and returns its result.
	 * 
	 * @param <T> The result type.
	 * @param query The query to run.
	 * @return The result of the query.
	 */
	public <T> T query(IKernelQuery<T> query)
	{
		CountDownLatch latch = new CountDownLatch(1);
		List<T> holder = new ArrayList<>();
		boolean didQueue = _runner.runOnKernelThread((Kernel kernel, IWorld world) -> {
			holder.add(query.run(kernel, world));
			latch.countDown();
		});
		// The shim owns the runner so it can't have shut down under us.
		Assert.assertTrue(didQueue);
		try
		{
			latch.await();
		}
		catch (InterruptedException e)
		{
			// We don't use interruption.
			throw Assert.unexpected(e);
		}
		return holder.get(0);
	}

	/**
	 * Blocks until the given number of frames have completed since the call was issued.
	 * 
	 * @param frameCount The number of frames to wait.
	 * @throws InterruptedException Interrupted while waiting for the frames to complete.
	 */
	public synchronized void waitForFrameAdvance(long frameCount) throws InterruptedException
	{
		long frameNumber = _lastFrame + frameCount;
		while (_lastFrame < frameNumber)
		{
			this.wait();
		}
	}

	/**
	 * @return A copy of every result applied by the frame loop so far, in application order.
	 */
	public synchronized List<ApplyResult> getFrameResults()
	{
		return new ArrayList<>(_results);
	}

	public MonitoringAgent getMonitoringAgent()
	{
		return _monitoringAgent;
	}

	/**
	 * Stops the frame loop, returning once the kernel thread has exited.
	 */
	public void shutdown()
	{
		_runner.shutdown();
	}


	private synchronized void _frameCompleted(FrameContext context, List<ApplyResult> results)
	{
		_results.addAll(results);
		_lastFrame = context.frame();
		this.notifyAll();
	}


	/**
	 * A read (or a direct kernel operation) run on the kernel thread.
	 */
	public static interface IKernelQuery<T>
	{
		T run(Kernel kernel, IWorld world);
	}
}
