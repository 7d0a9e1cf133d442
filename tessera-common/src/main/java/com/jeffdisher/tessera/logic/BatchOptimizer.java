package com.jeffdisher.tessera.logic;

import java.util.List;

import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.transactions.Transaction;
import com.jeffdisher.tessera.transactions.TransactionState;
import com.jeffdisher.tessera.types.TransactionId;
import com.jeffdisher.tessera.utils.Assert;


/**
 * Runs the enabled PatchBatch passes, in order:  merge, eliminate, sort.
 * The batch is first put in plain priority order, the order it would be applied in without optimization, so that
 * "later" means the same thing to every pass as it does to the applicator.  A batch which applies cleanly without
 * optimization leaves the world in the same state when optimized.
 */
public class BatchOptimizer
{
	private final boolean _mergeRedundant;
	private final boolean _eliminateContradictions;
	private final boolean _sortOptimal;

	public BatchOptimizer()
	{
		this(true, true, true);
	}

	public BatchOptimizer(boolean mergeRedundant, boolean eliminateContradictions, boolean sortOptimal)
	{
		_mergeRedundant = mergeRedundant;
		_eliminateContradictions = eliminateContradictions;
		_sortOptimal = sortOptimal;
	}

	/**
	 * Optimizes the batch in-place.
	 * 
	 * @param batch The batch to rewrite.
	 * @return What the passes did.
	 */
	public BatchStats optimize(PatchBatch batch)
	{
		int originalCount = batch.size();
		batch.sortByPriority();
		int merged = _mergeRedundant ? batch.mergeRedundant() : 0;
		int eliminated = _eliminateContradictions ? batch.eliminateContradictions() : 0;
		if (_sortOptimal)
		{
			batch.sortOptimal();
		}
		return new BatchStats(originalCount, batch.size(), merged, eliminated);
	}

	/**
	 * @param patches The patches to optimize (not modified).
	 * @return A new, optimized, list.
	 */
	public List<Patch> optimize(List<Patch> patches)
	{
		PatchBatch batch = new PatchBatch(patches);
		optimize(batch);
		return batch.getPatches();
	}

	/**
	 * Creates an optimized copy of a pending transaction, keeping its id, source, dependencies and description.
	 * 
	 * @param transaction A PENDING transaction.
	 * @return A new PENDING transaction with the optimized patches.
	 */
	public Transaction optimizeTransaction(Transaction transaction)
	{
		Assert.assertTrue(TransactionState.PENDING == transaction.getState());
		List<Patch> optimized = optimize(transaction.getPatches());
		Transaction copy = new Transaction(transaction.getId(), transaction.getSource(), transaction.getCreatedFrame());
		for (Patch patch : optimized)
		{
			copy.addPatch(patch);
		}
		for (TransactionId dependency : transaction.getDependencies())
		{
			copy.addDependency(dependency);
		}
		copy.setDescription(transaction.getDescription());
		copy.submit();
		return copy;
	}
}
