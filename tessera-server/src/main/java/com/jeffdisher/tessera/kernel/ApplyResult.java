package com.jeffdisher.tessera.kernel;

import com.jeffdisher.tessera.transactions.TransactionResult;
import com.jeffdisher.tessera.types.TransactionId;


/**
 * The outcome of applying one transaction.  On failure, patchesApplied is how many patches succeeded before the
 * failing one (all of which have been undone).
 */
public record ApplyResult(TransactionId transactionId
		, boolean success
		, int patchesApplied
		, String error
)
{
	public TransactionResult toTransactionResult()
	{
		return this.success
				? TransactionResult.success(this.transactionId, this.patchesApplied)
				: TransactionResult.failure(this.transactionId, this.error, this.patchesApplied)
		;
	}
}
