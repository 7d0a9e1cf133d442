package com.jeffdisher.tessera.logic;

import java.util.concurrent.atomic.AtomicLong;


/**
 * Just a wrapper over an atomic to assign increasing ids which are never reused.
 * Each kernel owns its own instances (one per id space) rather than using a process-wide counter, so that tests and
 * multiple kernels in one process get deterministic, independent sequences.
 */
public class MonotonicIdAssigner
{
	private final AtomicLong _next;

	/**
	 * @param first The first value which next() will return.
	 */
	public MonotonicIdAssigner(long first)
	{
		_next = new AtomicLong(first);
	}

	public long next()
	{
		return _next.getAndIncrement();
	}

	/**
	 * @return The value the next call to next() will return, without consuming it.
	 */
	public long peek()
	{
		return _next.get();
	}
}
