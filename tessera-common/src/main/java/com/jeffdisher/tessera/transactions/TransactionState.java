package com.jeffdisher.tessera.transactions;


/**
 * The life-cycle of a Transaction:
 * BUILDING -> PENDING -> APPLYING -> (COMMITTED | ROLLED_BACK)
 * A BUILDING transaction may be CANCELLED by its creator and a PENDING transaction is CANCELLED by the bus if it
 * waits too long for its dependencies.
 */
public enum TransactionState
{
	BUILDING,
	PENDING,
	APPLYING,
	COMMITTED,
	ROLLED_BACK,
	CANCELLED,
	;

	public boolean isTerminal()
	{
		return (COMMITTED == this) || (ROLLED_BACK == this) || (CANCELLED == this);
	}
}
