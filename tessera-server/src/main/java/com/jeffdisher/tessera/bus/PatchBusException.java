package com.jeffdisher.tessera.bus;


/**
 * Thrown when a transaction is refused at submission.  A refused transaction never enters the pending queue and
 * never changes any world state.
 */
public class PatchBusException extends Exception
{
	private static final long serialVersionUID = 1L;

	public enum Reason
	{
		TOO_MANY_PENDING_TRANSACTIONS,
		TOO_MANY_PATCHES,
		UNKNOWN_NAMESPACE,
		SOURCE_MISMATCH,
		PERMISSION_DENIED,
		RESOURCE_LIMIT_EXCEEDED,
		CHANNEL_FULL,
		VALIDATION_FAILED,
	}

	private final Reason _reason;

	public PatchBusException(Reason reason, String message)
	{
		super(reason + ": " + message);
		_reason = reason;
	}

	public Reason getReason()
	{
		return _reason;
	}
}
