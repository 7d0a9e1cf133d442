package com.jeffdisher.tessera.transactions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.TransactionId;
import com.jeffdisher.tessera.utils.Assert;


/**
 * An ordered batch of patches from one namespace which is validated, and then applied, as a unit.
 * A transaction is built on the producer's thread and, once submitted, is only touched by the kernel thread (the
 * hand-off through the bus channel publishes it) so it has no internal locking.
 * Illegal state transitions are programming errors and fail with AssertionError.
 */
public class Transaction
{
	public static final long NOT_APPLIED = -1L;

	private final TransactionId _id;
	private final NamespaceId _source;
	private final long _createdFrame;
	private TransactionState _state;
	private List<Patch> _patches;
	private final Set<TransactionId> _dependencies;
	private String _description;
	private long _appliedFrame;

	public Transaction(TransactionId id, NamespaceId source, long createdFrame)
	{
		_id = id;
		_source = source;
		_createdFrame = createdFrame;
		_state = TransactionState.BUILDING;
		_patches = new ArrayList<>();
		_dependencies = new LinkedHashSet<>();
		_description = null;
		_appliedFrame = NOT_APPLIED;
	}

	public void addPatch(Patch patch)
	{
		Assert.assertTrue(TransactionState.BUILDING == _state, "patches can only be added while building");
		_patches.add(patch);
	}

	public void addDependency(TransactionId dependency)
	{
		Assert.assertTrue(TransactionState.BUILDING == _state, "dependencies can only be added while building");
		_dependencies.add(dependency);
	}

	public void setDescription(String description)
	{
		Assert.assertTrue(TransactionState.BUILDING == _state, "description can only be set while building");
		_description = description;
	}

	/**
	 * Seals the transaction (no more patches or dependencies) and makes it ready for submission to the bus.
	 */
	public void submit()
	{
		Assert.assertTrue(TransactionState.BUILDING == _state, "only a building transaction can be submitted");
		_patches = Collections.unmodifiableList(_patches);
		_state = TransactionState.PENDING;
	}

	/**
	 * Abandons a transaction which was never submitted.
	 */
	public void cancel()
	{
		Assert.assertTrue(TransactionState.BUILDING == _state, "only a building transaction can be cancelled");
		_state = TransactionState.CANCELLED;
	}

	/**
	 * Called by the bus when a pending transaction has waited too long for its dependencies.
	 */
	public void expire()
	{
		Assert.assertTrue(TransactionState.PENDING == _state);
		_state = TransactionState.CANCELLED;
	}

	public void beginApplying()
	{
		Assert.assertTrue(TransactionState.PENDING == _state);
		_state = TransactionState.APPLYING;
	}

	public void markCommitted(long frame)
	{
		Assert.assertTrue(TransactionState.APPLYING == _state);
		_state = TransactionState.COMMITTED;
		_appliedFrame = frame;
	}

	public void markRolledBack(long frame)
	{
		Assert.assertTrue(TransactionState.APPLYING == _state);
		_state = TransactionState.ROLLED_BACK;
		_appliedFrame = frame;
	}

	/**
	 * @param committed The ids known to be committed (a consistent copy of the commit log).
	 * @return True if every dependency of this transaction is in committed.
	 */
	public boolean dependenciesSatisfied(Set<TransactionId> committed)
	{
		return committed.containsAll(_dependencies);
	}

	/**
	 * @return The highest priority of any patch (0 for an empty transaction).
	 */
	public int maxPriority()
	{
		int max = Integer.MIN_VALUE;
		for (Patch patch : _patches)
		{
			max = Math.max(max, patch.priority());
		}
		return _patches.isEmpty() ? 0 : max;
	}

	public TransactionId getId()
	{
		return _id;
	}

	public NamespaceId getSource()
	{
		return _source;
	}

	public TransactionState getState()
	{
		return _state;
	}

	public List<Patch> getPatches()
	{
		return Collections.unmodifiableList(_patches);
	}

	public int patchCount()
	{
		return _patches.size();
	}

	public Set<TransactionId> getDependencies()
	{
		return Collections.unmodifiableSet(_dependencies);
	}

	public long getCreatedFrame()
	{
		return _createdFrame;
	}

	public long getAppliedFrame()
	{
		return _appliedFrame;
	}

	public String getDescription()
	{
		return _description;
	}

	@Override
	public String toString()
	{
		return _id + "(" + _source + ", " + _state + ", " + _patches.size() + " patches"
				+ ((null != _description) ? (", \"" + _description + "\"") : "")
				+ ")";
	}
}
