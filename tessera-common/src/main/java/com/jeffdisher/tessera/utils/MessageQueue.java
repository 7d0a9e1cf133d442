package com.jeffdisher.tessera.utils;

import java.util.ArrayDeque;
import java.util.Deque;


/**
 * A blocking queue of Runnable requests, used to hand operator work to the thread which owns the kernel.
 * All methods are synchronized on the receiver, which is also the monitor used for waiting.
 */
public class MessageQueue
{
	private final Deque<Runnable> _requests = new ArrayDeque<>();
	private boolean _isOpen = true;

	/**
	 * Waits for the next request.  If timeoutRunnable is non-null, this waits at most millisToWait before returning it
	 * instead.  Once the queue is shut down, this returns null even if requests remain.
	 * 
	 * @param millisToWait Milliseconds to wait before returning timeoutRunnable (must be > 0L if it is non-null, and
	 * >= 0L otherwise).
	 * @param timeoutRunnable Returned when the timeout elapses with nothing queued (null to wait forever).
	 * @return The next Runnable, timeoutRunnable, or null if the queue was shut down.
	 */
	public synchronized Runnable pollForNext(long millisToWait, Runnable timeoutRunnable)
	{
		boolean hasTimeout = (null != timeoutRunnable);
		Assert.assertTrue(hasTimeout ? (millisToWait > 0L) : (millisToWait >= 0L));
		
		long waitMillis = hasTimeout ? millisToWait : 0L;
		boolean keepWaiting = true;
		while (_isOpen && keepWaiting && _requests.isEmpty())
		{
			try
			{
				this.wait(waitMillis);
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
			// A timed wait only happens once:  either the timer fired or something was enqueued.
			keepWaiting = !hasTimeout;
		}
		
		Runnable next;
		if (!_isOpen)
		{
			next = null;
		}
		else if (!_requests.isEmpty())
		{
			next = _requests.removeFirst();
		}
		else
		{
			next = timeoutRunnable;
		}
		if (_requests.isEmpty())
		{
			// Wake anyone in waitForEmptyQueue().
			this.notifyAll();
		}
		return next;
	}

	/**
	 * Adds a request to the end of the queue.
	 * 
	 * @param request The request to run on the consuming thread.
	 * @return True if it was queued, false if the queue has already been shut down.
	 */
	public synchronized boolean enqueue(Runnable request)
	{
		if (_isOpen)
		{
			_requests.addLast(request);
			this.notifyAll();
		}
		return _isOpen;
	}

	/**
	 * @return The number of requests which have not yet been consumed.
	 */
	public synchronized int pendingCount()
	{
		return _requests.size();
	}

	/**
	 * Blocks a non-consuming thread until the consuming thread has taken every queued request.
	 * The queue must not be shut down while this is waiting.
	 */
	public synchronized void waitForEmptyQueue()
	{
		while (!_requests.isEmpty())
		{
			Assert.assertTrue(_isOpen);
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
	}

	/**
	 * Closes the queue:  future enqueue() calls fail and any thread blocked in pollForNext() returns null.
	 */
	public synchronized void shutdown()
	{
		_isOpen = false;
		this.notifyAll();
	}
}
