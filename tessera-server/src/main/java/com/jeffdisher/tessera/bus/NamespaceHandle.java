package com.jeffdisher.tessera.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import com.jeffdisher.tessera.patches.IPatchKind;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.transactions.Transaction;
import com.jeffdisher.tessera.transactions.TransactionBuilder;
import com.jeffdisher.tessera.transactions.TransactionState;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.TransactionId;


/**
 * An application's entry point into the bus.  Each handle owns a bounded channel which is drained by the kernel at
 * the start of every frame, so submit() can be called from any thread and never blocks:  a full channel is reported
 * as CHANNEL_FULL.
 * Only the cheap structural checks happen here; permissions are checked when the kernel drains the channel.
 */
public class NamespaceHandle
{
	private final NamespaceId _namespace;
	private final PatchBus _bus;
	private final int _maxPatchesPerTransaction;
	private final BlockingQueue<Transaction> _channel;
	private volatile boolean _isClosed;

	NamespaceHandle(NamespaceId namespace, PatchBus bus, int channelCapacity, int maxPatchesPerTransaction)
	{
		_namespace = namespace;
		_bus = bus;
		_maxPatchesPerTransaction = maxPatchesPerTransaction;
		_channel = new ArrayBlockingQueue<>(channelCapacity);
		_isClosed = false;
	}

	public NamespaceId getNamespace()
	{
		return _namespace;
	}

	/**
	 * @return A builder for a new transaction from this namespace, with a freshly-assigned id.
	 */
	public TransactionBuilder beginTransaction()
	{
		return new TransactionBuilder(_bus.nextTransactionId(), _namespace, _bus.getCurrentFrame());
	}

	/**
	 * Queues a built transaction for the next frame.
	 * 
	 * @param transaction A PENDING transaction from this namespace.
	 * @return The id of the queued transaction.
	 * @throws PatchBusException The transaction was refused (nothing was queued).
	 */
	public TransactionId submit(Transaction transaction) throws PatchBusException
	{
		if (_isClosed)
		{
			throw new PatchBusException(PatchBusException.Reason.UNKNOWN_NAMESPACE, _namespace + " has been closed");
		}
		if (!_namespace.equals(transaction.getSource()))
		{
			throw new PatchBusException(PatchBusException.Reason.SOURCE_MISMATCH, "Transaction from " + transaction.getSource() + " submitted through handle for " + _namespace);
		}
		if (TransactionState.PENDING != transaction.getState())
		{
			throw new PatchBusException(PatchBusException.Reason.VALIDATION_FAILED, "Transaction is " + transaction.getState());
		}
		if (transaction.patchCount() > _maxPatchesPerTransaction)
		{
			throw new PatchBusException(PatchBusException.Reason.TOO_MANY_PATCHES, transaction.patchCount() + " > " + _maxPatchesPerTransaction);
		}
		if (!_channel.offer(transaction))
		{
			throw new PatchBusException(PatchBusException.Reason.CHANNEL_FULL, _namespace + " has " + _channel.size() + " queued transactions");
		}
		return transaction.getId();
	}

	/**
	 * Wraps a single patch in its own transaction and submits it.
	 */
	public TransactionId submitPatch(Patch patch) throws PatchBusException
	{
		Transaction transaction = beginTransaction()
				.patch(patch)
				.build();
		return submit(transaction);
	}

	/**
	 * Wraps a single patch kind (sourced from this namespace, at default priority) in its own transaction and submits
	 * it.
	 */
	public TransactionId submitPatch(IPatchKind kind) throws PatchBusException
	{
		return submitPatch(Patch.of(_namespace, kind));
	}

	/**
	 * @return The number of transactions waiting for the next frame.
	 */
	public int queuedCount()
	{
		return _channel.size();
	}

	public boolean isClosed()
	{
		return _isClosed;
	}

	void close()
	{
		_isClosed = true;
		_channel.clear();
	}

	List<Transaction> drainChannel()
	{
		List<Transaction> drained = new ArrayList<>();
		_channel.drainTo(drained);
		return drained;
	}
}
