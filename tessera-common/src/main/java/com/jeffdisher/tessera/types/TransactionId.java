package com.jeffdisher.tessera.types;


/**
 * Identifies a transaction.  These are assigned in increasing order and never reused.
 */
public record TransactionId(long value) implements Comparable<TransactionId>
{
	@Override
	public int compareTo(TransactionId other)
	{
		return Long.compare(this.value, other.value);
	}

	@Override
	public String toString()
	{
		return "tx:" + this.value;
	}
}
