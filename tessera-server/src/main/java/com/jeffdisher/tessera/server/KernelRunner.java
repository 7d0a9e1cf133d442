package com.jeffdisher.tessera.server;

import java.util.List;
import java.util.function.LongSupplier;

import com.jeffdisher.tessera.kernel.ApplyResult;
import com.jeffdisher.tessera.kernel.FrameContext;
import com.jeffdisher.tessera.kernel.Kernel;
import com.jeffdisher.tessera.snapshots.StateSnapshot;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.SnapshotId;
import com.jeffdisher.tessera.utils.Assert;
import com.jeffdisher.tessera.utils.MessageQueue;
import com.jeffdisher.tessera.world.IWorld;


/**
 * Drives a Kernel on its own thread, running a frame every millisPerFrame and interleaving operator requests between
 * frames.  It is designed to be embedded, so the kernel, world and clock are all injected.
 * Everything which touches the kernel or the world runs on the background thread, so the only ways in from other
 * threads are the NamespaceHandles and the MonitoringAgent's command sink.
 */
public class KernelRunner
{
	// General and configuration variables.
	private final long _millisPerFrame;
	private final Kernel _kernel;
	private final IWorld _world;
	private final IFrameListener _listener;

	// Information related to internal thread state and message passing.
	private final MessageQueue _messages;
	private final Thread _background;

	// Variables "owned" by the background thread.
	private final LongSupplier _currentTimeMillisProvider;
	private final MonitoringAgent _monitoringAgent;
	private final _FrameAdvancer _frameAdvancer;
	private long _nextFrameMillis;
	private long _lastFrameMillis;

	/**
	 * Creates the runner and starts its thread.
	 *
	 * @param millisPerFrame The target frame period.
	 * @param kernel The kernel to drive (now owned by this runner's thread).
	 * @param world The world the kernel mutates (now owned by this runner's thread).
	 * @param currentTimeMillisProvider The clock used for scheduling and frame deltas.
	 * @param monitoringAgent Receives a FrameReport after every frame.
	 * @param listener Called on the kernel thread after every frame (can be null).
	 */
	public KernelRunner(long millisPerFrame
			, Kernel kernel
			, IWorld world
			, LongSupplier currentTimeMillisProvider
			, MonitoringAgent monitoringAgent
			, IFrameListener listener
	)
	{
		Assert.assertTrue(millisPerFrame > 0L);
		_millisPerFrame = millisPerFrame;
		_kernel = kernel;
		_world = world;
		_listener = listener;

		_messages = new MessageQueue();
		_background = new Thread(()-> {
			try
			{
				_backgroundMain();
			}
			catch (Throwable t)
			{
				// This is a fatal error so just stop.
				t.printStackTrace();
				System.exit(101);
			}
		}, "KernelRunner");
		_currentTimeMillisProvider = currentTimeMillisProvider;
		_monitoringAgent = monitoringAgent;
		_frameAdvancer = new _FrameAdvancer();

		// Register our various attachments into the monitoring agent.
		_monitoringAgent.setKernel(kernel);
		_monitoringAgent.setOperatorCommandSink(new MonitoringAgent.OperatorCommandSink()
		{
			@Override
			public void requestSnapshot()
			{
				_messages.enqueue(() -> {
					StateSnapshot snapshot = _kernel.takeSnapshot(_world);
					System.out.println("Captured snapshot " + snapshot.getId().value() + " at frame " + snapshot.getFrame());
				});
			}
			@Override
			public void requestRollback(SnapshotId snapshotId)
			{
				_messages.enqueue(() -> {
					ApplyResult result = _kernel.rollbackTo(snapshotId, _world);
					if (null == result)
					{
						System.out.println("WARNING:  Snapshot " + snapshotId.value() + " not found");
					}
					else if (result.success())
					{
						System.out.println("Rolled back to snapshot " + snapshotId.value() + " (" + result.patchesApplied() + " patches)");
					}
					else
					{
						System.out.println("WARNING:  Rollback to snapshot " + snapshotId.value() + " failed: " + result.error());
					}
				});
			}
			@Override
			public void requestDestroyNamespace(NamespaceId namespace)
			{
				_messages.enqueue(() -> {
					boolean didDestroy = _kernel.destroyNamespace(namespace, _world);
					if (didDestroy)
					{
						System.out.println("Destroyed " + namespace);
					}
					else
					{
						System.out.println("WARNING:  Cannot destroy " + namespace);
					}
				});
			}
			@Override
			public void pauseFrameProcessing()
			{
				_frameAdvancer.pause();
			}
			@Override
			public void resumeFrameProcessing()
			{
				_frameAdvancer.resume();
			}
		});

		// Starting a thread in a constructor isn't ideal but this does give us a simple interface.
		_background.start();
	}

	/**
	 * Queues a task to run on the kernel thread, between frames.
	 *
	 * @param task The task, given the kernel and world.
	 * @return False if the runner has already shut down.
	 */
	public boolean runOnKernelThread(IKernelTask task)
	{
		return _messages.enqueue(() -> {
			task.run(_kernel, _world);
		});
	}

	/**
	 * Blocks until everything queued before this call has run on the kernel thread.
	 */
	public void waitForQueuedTasks()
	{
		_messages.waitForEmptyQueue();
	}

	/**
	 * Shuts down the runner, returning once the internal thread has joined.
	 */
	public void shutdown()
	{
		// Stop accepting messages.
		_messages.shutdown();

		// Stop the background thread so that it stops trying to run frames.
		try
		{
			_background.join();
		}
		catch (InterruptedException e)
		{
			// We don't use interruption.
			throw Assert.unexpected(e);
		}
	}


	private void _backgroundMain()
	{
		_lastFrameMillis = _currentTimeMillisProvider.getAsLong();
		_nextFrameMillis = _lastFrameMillis + _millisPerFrame;
		Runnable next = _messages.pollForNext(_millisPerFrame, _frameAdvancer);
		while (null != next)
		{
			next.run();
			long currentTime = _currentTimeMillisProvider.getAsLong();
			long millisToWait = _nextFrameMillis - currentTime;
			if (millisToWait <= 0L)
			{
				if (millisToWait < -_millisPerFrame)
				{
					// We only want to log that we are dropping a frame if we are more than 1 frame behind.
					System.out.println("WARNING:  Dropping frame!");
					_nextFrameMillis = currentTime;
				}
				// We are due so run it now, not even going through the message queue.
				_frameAdvancer.run();
				millisToWait = _nextFrameMillis - _currentTimeMillisProvider.getAsLong();
			}
			// The clock is injected so we never wait longer than a frame, even if it says otherwise.
			millisToWait = Math.max(1L, Math.min(millisToWait, _millisPerFrame));
			next = _messages.pollForNext(millisToWait, _frameAdvancer);
		}
	}


	/**
	 * A task run on the kernel thread.
	 */
	public static interface IKernelTask
	{
		void run(Kernel kernel, IWorld world);
	}

	private final class _FrameAdvancer implements Runnable
	{
		private volatile boolean _isPaused;

		@Override
		public void run()
		{
			long frameStart = _currentTimeMillisProvider.getAsLong();
			if (_isPaused)
			{
				// Paused frames are not run, but we keep the schedule (and the delta) anchored to "now".
				_lastFrameMillis = frameStart;
				_nextFrameMillis = frameStart + _millisPerFrame;
				return;
			}

			float deltaTime = (float)(frameStart - _lastFrameMillis) / 1000.0f;
			_lastFrameMillis = frameStart;
			FrameContext context = _kernel.beginFrame(deltaTime);
			List<ApplyResult> results = _kernel.processTransactions(_world);
			_kernel.endFrame();
			long millisInFrame = _currentTimeMillisProvider.getAsLong() - frameStart;

			FrameReport report = new FrameReport(context.frame()
					, context.deltaTime()
					, List.copyOf(results)
					, _kernel.stats(_world)
					, millisInFrame
			);
			_monitoringAgent.framePublished(report);
			if (null != _listener)
			{
				_listener.frameCompleted(context, results);
			}

			// Determine when the next frame should run (we increment the previous time to not slide).
			_nextFrameMillis += _millisPerFrame;
			if (millisInFrame > _millisPerFrame)
			{
				report.writeToStream(System.out);
			}
		}
		public void pause()
		{
			_isPaused = true;
		}
		public void resume()
		{
			_isPaused = false;
		}
	}
}
