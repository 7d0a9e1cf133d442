package com.jeffdisher.tessera.types;


/**
 * Identifies a single capability grant so that it can later be revoked.
 */
public record CapabilityId(long value)
{
	@Override
	public String toString()
	{
		return "cap:" + this.value;
	}
}
