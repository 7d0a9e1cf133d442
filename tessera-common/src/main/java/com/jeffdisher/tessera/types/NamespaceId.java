package com.jeffdisher.tessera.types;


/**
 * The opaque identity of a namespace (one isolated application or tenant).  The value 0 is reserved for the kernel,
 * which has unrestricted access.
 */
public record NamespaceId(long value) implements Comparable<NamespaceId>
{
	public static final NamespaceId KERNEL = new NamespaceId(0L);

	public boolean isKernel()
	{
		return 0L == this.value;
	}

	@Override
	public int compareTo(NamespaceId other)
	{
		return Long.compare(this.value, other.value);
	}

	@Override
	public String toString()
	{
		return isKernel() ? "ns:kernel" : ("ns:" + this.value);
	}
}
