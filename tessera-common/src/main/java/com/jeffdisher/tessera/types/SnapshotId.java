package com.jeffdisher.tessera.types;


/**
 * Identifies a stored snapshot.  These are assigned in increasing order and never reused.
 */
public record SnapshotId(long value)
{
	@Override
	public String toString()
	{
		return "snapshot:" + this.value;
	}
}
