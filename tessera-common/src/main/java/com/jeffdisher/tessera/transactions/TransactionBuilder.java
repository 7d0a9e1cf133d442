package com.jeffdisher.tessera.transactions;

import java.util.Collection;

import com.jeffdisher.tessera.patches.IPatchKind;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.TransactionId;


/**
 * A fluent helper for assembling a Transaction on behalf of one namespace.  Patches added by kind are stamped with
 * the builder's namespace as their source.
 */
public class TransactionBuilder
{
	private final TransactionId _id;
	private final NamespaceId _source;
	private final Transaction _transaction;

	public TransactionBuilder(TransactionId id, NamespaceId source, long createdFrame)
	{
		_id = id;
		_source = source;
		_transaction = new Transaction(id, source, createdFrame);
	}

	public TransactionId getId()
	{
		return _id;
	}

	public TransactionBuilder description(String description)
	{
		_transaction.setDescription(description);
		return this;
	}

	public TransactionBuilder patch(IPatchKind kind)
	{
		_transaction.addPatch(Patch.of(_source, kind));
		return this;
	}

	public TransactionBuilder patch(IPatchKind kind, int priority)
	{
		_transaction.addPatch(Patch.of(_source, kind, priority));
		return this;
	}

	/**
	 * Adds a fully-formed patch as-is (including its source, which the bus will check).
	 */
	public TransactionBuilder patch(Patch patch)
	{
		_transaction.addPatch(patch);
		return this;
	}

	public TransactionBuilder patches(Collection<Patch> patches)
	{
		for (Patch patch : patches)
		{
			_transaction.addPatch(patch);
		}
		return this;
	}

	public TransactionBuilder dependsOn(TransactionId dependency)
	{
		_transaction.addDependency(dependency);
		return this;
	}

	/**
	 * @return The transaction, submitted (PENDING) and ready to be handed to the bus.
	 */
	public Transaction build()
	{
		_transaction.submit();
		return _transaction;
	}

	/**
	 * @return The transaction, still BUILDING, so that more patches can be added before submitting it.
	 */
	public Transaction buildDraft()
	{
		return _transaction;
	}
}
