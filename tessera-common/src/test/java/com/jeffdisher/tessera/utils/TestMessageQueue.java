package com.jeffdisher.tessera.utils;

import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;

import org.junit.Assert;
import org.junit.Test;


public class TestMessageQueue
{
	@Test
	public void startStop() throws Throwable
	{
		// Start and stop the queue without doing anything, on one thread.
		MessageQueue queue = new MessageQueue();
		queue.shutdown();
		Assert.assertNull(queue.pollForNext(0L, null));
		Assert.assertFalse(queue.enqueue(() -> {}));
	}

	@Test
	public void basicConsumer() throws Throwable
	{
		MessageQueue queue = new MessageQueue();
		Thread thread = _startConsumer(queue, 0L, null);
		
		int count[] = new int[1];
		for (int i = 0; i < 10; ++i)
		{
			queue.enqueue(() -> {
				count[0] += 1;
			});
		}
		CyclicBarrier barrier = new CyclicBarrier(2);
		queue.enqueue(() -> {
			_await(barrier);
		});
		barrier.await();
		queue.shutdown();
		thread.join();
		Assert.assertEquals(10, count[0]);
	}

	@Test
	public void timeoutRunsWhenIdle() throws Throwable
	{
		// Pre-populate the queue and then use a timeout runnable to await on the barrier - it should only run when everything else is done.
		MessageQueue queue = new MessageQueue();
		int count[] = new int[1];
		for (int i = 0; i < 10; ++i)
		{
			queue.enqueue(() -> {
				count[0] += 1;
			});
		}
		
		CyclicBarrier barrier = new CyclicBarrier(2);
		Thread thread = _startConsumer(queue, 1L, () -> {
			_await(barrier);
		});
		
		barrier.await();
		queue.shutdown();
		thread.join();
		Assert.assertEquals(10, count[0]);
	}

	@Test
	public void shutdownFull() throws Throwable
	{
		MessageQueue queue = new MessageQueue();
		int count[] = new int[1];
		for (int i = 0; i < 10; ++i)
		{
			queue.enqueue(() -> {
				count[0] += 1;
			});
		}
		Assert.assertEquals(10, queue.pendingCount());
		// Shut down before the consumer starts so nothing is run.
		queue.shutdown();
		Thread thread = _startConsumer(queue, 0L, null);
		thread.join();
		Assert.assertEquals(0, count[0]);
	}

	@Test
	public void drainBeforeShutdown() throws Throwable
	{
		MessageQueue queue = new MessageQueue();
		int count[] = new int[1];
		for (int i = 0; i < 10; ++i)
		{
			queue.enqueue(() -> {
				count[0] += 1;
			});
		}
		Thread thread = _startConsumer(queue, 0L, null);
		queue.waitForEmptyQueue();
		queue.shutdown();
		thread.join();
		Assert.assertEquals(10, count[0]);
		Assert.assertEquals(0, queue.pendingCount());
	}


	private static Thread _startConsumer(MessageQueue queue, long millisToWait, Runnable timeout)
	{
		Thread thread = new Thread(() -> {
			Runnable r = queue.pollForNext(millisToWait, timeout);
			while (null != r)
			{
				r.run();
				r = queue.pollForNext(millisToWait, timeout);
			}
		});
		thread.start();
		return thread;
	}

	private static void _await(CyclicBarrier barrier)
	{
		try
		{
			barrier.await();
		}
		catch (InterruptedException | BrokenBarrierException e)
		{
			// Not expected.
			Assert.fail();
		}
	}
}
