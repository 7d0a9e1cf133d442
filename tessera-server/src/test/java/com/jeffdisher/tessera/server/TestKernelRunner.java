package com.jeffdisher.tessera.server;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.tessera.bus.NamespaceHandle;
import com.jeffdisher.tessera.config.KernelConfig;
import com.jeffdisher.tessera.kernel.ApplyResult;
import com.jeffdisher.tessera.kernel.FrameContext;
import com.jeffdisher.tessera.kernel.Kernel;
import com.jeffdisher.tessera.namespaces.ResourceLimits;
import com.jeffdisher.tessera.patches.ComponentPatch;
import com.jeffdisher.tessera.patches.EntityPatch;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.SnapshotId;
import com.jeffdisher.tessera.types.TransactionId;
import com.jeffdisher.tessera.types.Value;
import com.jeffdisher.tessera.world.ArenaWorld;
import com.jeffdisher.tessera.world.EntityRecord;
import com.jeffdisher.tessera.world.IWorld;


public class TestKernelRunner
{
	private static final long MILLIS_PER_FRAME = 10L;

	@Test
	public void startStop() throws Throwable
	{
		// Get the starting number of threads in our group.
		int startingActiveCount = Thread.currentThread().getThreadGroup().activeCount();
		MonitoringAgent monitoringAgent = new MonitoringAgent();
		Kernel kernel = new Kernel(new KernelConfig(), () -> System.currentTimeMillis());
		KernelRunner runner = new KernelRunner(MILLIS_PER_FRAME
				, kernel
				, new ArenaWorld()
				, () -> System.currentTimeMillis()
				, monitoringAgent
				, null
		);
		// We expect to see the one extra thread.
		Assert.assertEquals(startingActiveCount + 1, Thread.currentThread().getThreadGroup().activeCount());
		Assert.assertSame(kernel, monitoringAgent.getKernel());
		Assert.assertNotNull(monitoringAgent.getCommandSink());
		runner.shutdown();
		
		// Verify that the thread has stopped.
		Assert.assertEquals(startingActiveCount, Thread.currentThread().getThreadGroup().activeCount());
		Assert.assertFalse(runner.runOnKernelThread((Kernel k, IWorld w) -> {}));
	}

	@Test
	public void framesApplySubmissions() throws Throwable
	{
		MonitoringAgent monitoringAgent = new MonitoringAgent();
		Kernel kernel = new Kernel(new KernelConfig(), () -> System.currentTimeMillis());
		NamespaceId app = kernel.registerNamespace("app", ResourceLimits.DEFAULT_APP);
		NamespaceHandle handle = kernel.createHandle(app);
		AtomicInteger listenerResults = new AtomicInteger(0);
		KernelRunner runner = new KernelRunner(MILLIS_PER_FRAME
				, kernel
				, new ArenaWorld()
				, () -> System.currentTimeMillis()
				, monitoringAgent
				, (FrameContext context, List<ApplyResult> results) -> listenerResults.addAndGet(results.size())
		);
		
		// Submitted from this thread, applied on the kernel thread.
		EntityRef ref = EntityRef.of(app, 1L);
		handle.submitPatch(EntityPatch.create(ref));
		TransactionId last = handle.submit(handle.beginTransaction()
				.patch(ComponentPatch.set(ref, "Health", Value.ofInt(7L)))
				.build()
		);
		long startFrame = (null != monitoringAgent.getLastReport()) ? monitoringAgent.getLastReport().frame() : 0L;
		FrameReport report = monitoringAgent.waitForFrame(startFrame + 2L);
		Assert.assertTrue(report.frame() >= (startFrame + 2L));
		
		Value[] health = new Value[1];
		boolean[] committed = new boolean[1];
		_runAndWait(runner, (Kernel k, IWorld world) -> {
			EntityRecord record = world.get(ref);
			health[0] = (null != record) ? record.getComponent("Health") : null;
			committed[0] = k.getBus().isCommitted(last);
		});
		Assert.assertEquals(7L, health[0].asInt());
		Assert.assertTrue(committed[0]);
		runner.shutdown();
		Assert.assertEquals(2, listenerResults.get());
	}

	@Test
	public void operatorSnapshotAndRollback() throws Throwable
	{
		MonitoringAgent monitoringAgent = new MonitoringAgent();
		Kernel kernel = new Kernel(new KernelConfig(), () -> System.currentTimeMillis());
		NamespaceId app = kernel.registerNamespace("app", ResourceLimits.DEFAULT_APP);
		NamespaceHandle handle = kernel.createHandle(app);
		KernelRunner runner = new KernelRunner(MILLIS_PER_FRAME
				, kernel
				, new ArenaWorld()
				, () -> System.currentTimeMillis()
				, monitoringAgent
				, null
		);
		
		// Pause so that nothing gets applied between our steps.
		monitoringAgent.getCommandSink().pauseFrameProcessing();
		EntityRef ref = EntityRef.of(app, 1L);
		monitoringAgent.getCommandSink().requestSnapshot();
		int[] snapshotCount = new int[1];
		_runAndWait(runner, (Kernel k, IWorld world) -> {
			snapshotCount[0] = k.getSnapshots().size();
		});
		Assert.assertEquals(1, snapshotCount[0]);
		
		monitoringAgent.getCommandSink().resumeFrameProcessing();
		handle.submitPatch(EntityPatch.create(ref));
		// Wait for the entity to show up.
		boolean[] exists = new boolean[1];
		while (!exists[0])
		{
			FrameReport report = monitoringAgent.getLastReport();
			monitoringAgent.waitForFrame(((null != report) ? report.frame() : 0L) + 1L);
			_runAndWait(runner, (Kernel k, IWorld world) -> {
				exists[0] = world.contains(ref);
			});
		}
		
		long snapshotId = kernel.getSnapshots().list().get(0).getId().value();
		monitoringAgent.getCommandSink().requestRollback(new SnapshotId(snapshotId));
		_runAndWait(runner, (Kernel k, IWorld world) -> {
			exists[0] = world.contains(ref);
		});
		Assert.assertFalse(exists[0]);
		
		// Destroying the namespace closes its handle.
		monitoringAgent.getCommandSink().requestDestroyNamespace(app);
		_runAndWait(runner, (Kernel k, IWorld world) -> {});
		Assert.assertTrue(handle.isClosed());
		runner.shutdown();
	}

	@Test
	public void pausedRunnerPublishesNothing() throws Throwable
	{
		MonitoringAgent monitoringAgent = new MonitoringAgent();
		Kernel kernel = new Kernel(new KernelConfig(), () -> System.currentTimeMillis());
		KernelRunner runner = new KernelRunner(MILLIS_PER_FRAME
				, kernel
				, new ArenaWorld()
				, () -> System.currentTimeMillis()
				, monitoringAgent
				, null
		);
		monitoringAgent.getCommandSink().pauseFrameProcessing();
		// Any frame already in progress finishes before this runs.
		long[] frame = new long[1];
		_runAndWait(runner, (Kernel k, IWorld world) -> {
			frame[0] = k.getCurrentFrame();
		});
		Thread.sleep(5L * MILLIS_PER_FRAME);
		long[] later = new long[1];
		_runAndWait(runner, (Kernel k, IWorld world) -> {
			later[0] = k.getCurrentFrame();
		});
		Assert.assertEquals(frame[0], later[0]);
		
		monitoringAgent.getCommandSink().resumeFrameProcessing();
		monitoringAgent.waitForFrame(later[0] + 1L);
		runner.shutdown();
	}


	private static void _runAndWait(KernelRunner runner, KernelRunner.IKernelTask task) throws InterruptedException
	{
		CountDownLatch latch = new CountDownLatch(1);
		Assert.assertTrue(runner.runOnKernelThread((Kernel kernel, IWorld world) -> {
			task.run(kernel, world);
			latch.countDown();
		}));
		latch.await();
	}
}
