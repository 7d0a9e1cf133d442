package com.jeffdisher.tessera.utils;


/**
 * Fail-fast checks for programming errors.  These are never used to report bad data from applications (that is
 * always reported as a result or checked exception) but only for states which the kernel itself should never reach.
 */
public class Assert
{
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true");
		}
	}

	public static void assertTrue(boolean flag, String description)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true: " + description);
		}
	}

	public static <T> T assertNotNull(T value)
	{
		if (null == value)
		{
			throw new AssertionError("Value expected to be non-null");
		}
		return value;
	}

	public static AssertionError unreachable()
	{
		throw new AssertionError("Code path unreachable");
	}

	public static AssertionError unexpected(Throwable t)
	{
		throw new AssertionError("Unexpected exception", t);
	}
}
