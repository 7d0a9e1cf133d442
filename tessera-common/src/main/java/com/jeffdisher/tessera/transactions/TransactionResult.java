package com.jeffdisher.tessera.transactions;

import com.jeffdisher.tessera.types.TransactionId;


/**
 * The outcome of applying one transaction, as recorded in the bus.
 * patchesApplied reports how far application got, even on failure (where all of those writes were undone).
 */
public record TransactionResult(TransactionId id
		, boolean success
		, String error
		, int patchesApplied
)
{
	public static TransactionResult success(TransactionId id, int patchesApplied)
	{
		return new TransactionResult(id, true, null, patchesApplied);
	}

	public static TransactionResult failure(TransactionId id, String error, int patchesApplied)
	{
		return new TransactionResult(id, false, error, patchesApplied);
	}
}
