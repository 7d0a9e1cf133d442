package com.jeffdisher.tessera.bus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.jeffdisher.tessera.config.KernelConfig;
import com.jeffdisher.tessera.logic.MonotonicIdAssigner;
import com.jeffdisher.tessera.namespaces.NamespaceManager;
import com.jeffdisher.tessera.namespaces.ResourceLimits;
import com.jeffdisher.tessera.transactions.Transaction;
import com.jeffdisher.tessera.transactions.TransactionResult;
import com.jeffdisher.tessera.transactions.TransactionState;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.TransactionId;
import com.jeffdisher.tessera.utils.Assert;


/**
 * The ingress queue between applications and the kernel.
 * Transactions arrive either through a NamespaceHandle's channel (drained in beginFrame()) or through a direct
 * submit() from the kernel thread.  Either way they are validated before entering the pending queue.  Each frame,
 * drainReady() hands the kernel the pending transactions whose dependencies are all in the commit log, and the
 * kernel reports each outcome back through commit().
 * The pending queue, commit log and counters are behind a read-write lock so that monitoring can read stats from
 * other threads.
 */
public class PatchBus
{
	private final NamespaceManager _namespaces;
	private final SubmissionValidator _validator;
	private final MonotonicIdAssigner _transactionIds;
	private final int _maxPendingTransactions;
	private final int _maxPatchesPerTransaction;
	private final int _channelCapacity;
	private final long _maxPendingFrames;

	private final List<NamespaceHandle> _handles = new CopyOnWriteArrayList<>();
	private final ReentrantReadWriteLock _lock = new ReentrantReadWriteLock();
	private final List<_Pending> _pending = new ArrayList<>();
	private final ArrayDeque<TransactionId> _commitOrder = new ArrayDeque<>();
	private final Set<TransactionId> _committed = new HashSet<>();
	// Transactions handed out by drainReady() but not yet committed or requeued.
	private final Map<TransactionId, _Pending> _inFlight = new HashMap<>();
	private final Map<NamespaceId, Integer> _patchesThisFrameByNamespace = new HashMap<>();
	private volatile long _currentFrame;
	private long _arrivalCounter;

	private long _submittedCount;
	private long _committedCount;
	private long _rolledBackCount;
	private long _rejectedCount;
	private long _expiredCount;
	private long _patchesAppliedCount;
	private int _patchesThisFrame;
	private int _peakPending;

	public PatchBus(KernelConfig config, NamespaceManager namespaces, MonotonicIdAssigner transactionIds)
	{
		_namespaces = namespaces;
		_validator = new SubmissionValidator(namespaces);
		_transactionIds = transactionIds;
		_maxPendingTransactions = config.maxPendingTransactions;
		_maxPatchesPerTransaction = config.maxPatchesPerTransaction;
		_channelCapacity = config.channelCapacity;
		_maxPendingFrames = config.maxPendingFrames;
	}

	/**
	 * Creates a handle for an existing namespace.  Any thread may use the returned handle.
	 * 
	 * @param namespace The namespace the handle submits for.
	 * @return The handle, or null if the namespace doesn't exist.
	 */
	public NamespaceHandle createHandle(NamespaceId namespace)
	{
		NamespaceHandle handle = null;
		if (_namespaces.exists(namespace))
		{
			handle = new NamespaceHandle(namespace, this, _channelCapacity, _maxPatchesPerTransaction);
			_handles.add(handle);
		}
		return handle;
	}

	public TransactionId nextTransactionId()
	{
		return new TransactionId(_transactionIds.next());
	}

	public long getCurrentFrame()
	{
		return _currentFrame;
	}

	/**
	 * Validates and queues a transaction.  Only called on the kernel thread.
	 * 
	 * @param transaction The PENDING transaction to queue.
	 * @throws PatchBusException The transaction was refused (it is not queued and nothing changed).
	 */
	public void submit(Transaction transaction) throws PatchBusException
	{
		_lock.writeLock().lock();
		try
		{
			_validateAndEnqueue(transaction);
		}
		catch (PatchBusException e)
		{
			_rejectedCount += 1L;
			throw e;
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	/**
	 * Starts a frame:  resets the per-frame quotas, then validates and queues everything waiting in the namespace
	 * channels.  Refused transactions are counted and logged, since their submitters have already returned.
	 * 
	 * @param frame The number of the frame being started.
	 */
	public void beginFrame(long frame)
	{
		_lock.writeLock().lock();
		try
		{
			_currentFrame = frame;
			_patchesThisFrame = 0;
			_patchesThisFrameByNamespace.clear();
			for (NamespaceHandle handle : _handles)
			{
				for (Transaction transaction : handle.drainChannel())
				{
					try
					{
						_validateAndEnqueue(transaction);
					}
					catch (PatchBusException e)
					{
						_rejectedCount += 1L;
						System.out.println("WARNING:  Rejected " + transaction + ": " + e.getMessage());
					}
					catch (RuntimeException e)
					{
						// A malformed transaction from one handle must not stop the others from draining.
						_rejectedCount += 1L;
						System.out.println("WARNING:  Rejected malformed transaction " + transaction.getId() + ": " + e);
					}
				}
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	/**
	 * Removes and returns the pending transactions whose dependencies have all committed, highest priority first (ties
	 * in arrival order).  Transactions which have waited more than the configured number of frames are expired
	 * (CANCELLED) instead.
	 * 
	 * @param frame The current frame number.
	 * @return The ready transactions, in the order they should be applied.
	 */
	public List<Transaction> drainReady(long frame)
	{
		List<_Pending> ready = new ArrayList<>();
		List<Transaction> expired = new ArrayList<>();
		_lock.writeLock().lock();
		try
		{
			// We check against a copy so that every transaction in this drain sees the same commit log.
			Set<TransactionId> committed = new HashSet<>(_committed);
			Iterator<_Pending> iterator = _pending.iterator();
			while (iterator.hasNext())
			{
				_Pending pending = iterator.next();
				if (pending.transaction.dependenciesSatisfied(committed))
				{
					ready.add(pending);
					_inFlight.put(pending.transaction.getId(), pending);
					iterator.remove();
				}
				else if ((frame - pending.frameQueued) > _maxPendingFrames)
				{
					pending.transaction.expire();
					expired.add(pending.transaction);
					_expiredCount += 1L;
					iterator.remove();
				}
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
		for (Transaction transaction : expired)
		{
			System.out.println("WARNING:  Expired " + transaction + " waiting on " + transaction.getDependencies());
		}
		
		ready.sort((_Pending a, _Pending b) -> {
			int compare = Integer.compare(b.transaction.maxPriority(), a.transaction.maxPriority());
			return (0 != compare) ? compare : Long.compare(a.arrival, b.arrival);
		});
		List<Transaction> transactions = new ArrayList<>();
		for (_Pending pending : ready)
		{
			transactions.add(pending.transaction);
		}
		return transactions;
	}

	/**
	 * Puts a transaction returned by drainReady() back into the pending queue, in its original arrival position, so it
	 * is reconsidered next frame.  It keeps its original queued frame, so it can still expire.
	 * 
	 * @param transaction A PENDING transaction previously returned by drainReady().
	 */
	public void requeue(Transaction transaction)
	{
		_lock.writeLock().lock();
		try
		{
			_Pending pending = _inFlight.remove(transaction.getId());
			Assert.assertTrue(null != pending);
			int index = 0;
			while ((index < _pending.size()) && (_pending.get(index).arrival < pending.arrival))
			{
				index += 1;
			}
			_pending.add(index, pending);
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	/**
	 * Records the outcome of applying a transaction.
	 * 
	 * @param result The result reported by the applicator.
	 */
	public void commit(TransactionResult result)
	{
		_lock.writeLock().lock();
		try
		{
			_inFlight.remove(result.id());
			if (result.success())
			{
				if (_committed.add(result.id()))
				{
					_commitOrder.addLast(result.id());
				}
				_committedCount += 1L;
				_patchesAppliedCount += result.patchesApplied();
			}
			else
			{
				_rolledBackCount += 1L;
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	/**
	 * Drops the oldest entries of the commit log until at most keepCount remain.  A transaction depending on a dropped
	 * id will never become ready (and will eventually expire).
	 * 
	 * @param keepCount The number of most recent commits to keep.
	 * @return The number of ids dropped.
	 */
	public int gcCommitted(int keepCount)
	{
		_lock.writeLock().lock();
		try
		{
			int dropped = 0;
			while (_commitOrder.size() > keepCount)
			{
				_committed.remove(_commitOrder.removeFirst());
				dropped += 1;
			}
			return dropped;
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	public boolean isCommitted(TransactionId id)
	{
		_lock.readLock().lock();
		try
		{
			return _committed.contains(id);
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public int pendingCount()
	{
		_lock.readLock().lock();
		try
		{
			return _pending.size();
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public PatchBusStats stats()
	{
		_lock.readLock().lock();
		try
		{
			return new PatchBusStats(_submittedCount
					, _committedCount
					, _rolledBackCount
					, _rejectedCount
					, _expiredCount
					, _patchesAppliedCount
					, _patchesThisFrame
					, _peakPending
					, _pending.size()
					, _commitOrder.size()
			);
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	/**
	 * Closes the namespace's handles and drops its pending transactions.  Called when a namespace is destroyed.
	 * 
	 * @param namespace The namespace being removed.
	 * @return The number of pending transactions dropped.
	 */
	public int removeNamespace(NamespaceId namespace)
	{
		for (NamespaceHandle handle : _handles)
		{
			if (namespace.equals(handle.getNamespace()))
			{
				handle.close();
				_handles.remove(handle);
			}
		}
		_lock.writeLock().lock();
		try
		{
			int dropped = 0;
			Iterator<_Pending> iterator = _pending.iterator();
			while (iterator.hasNext())
			{
				_Pending pending = iterator.next();
				if (namespace.equals(pending.transaction.getSource()))
				{
					pending.transaction.expire();
					iterator.remove();
					dropped += 1;
				}
			}
			return dropped;
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}


	// Must be called with the write lock held.
	private void _validateAndEnqueue(Transaction transaction) throws PatchBusException
	{
		if (TransactionState.PENDING != transaction.getState())
		{
			throw new PatchBusException(PatchBusException.Reason.VALIDATION_FAILED, transaction + " is not pending");
		}
		if (_committed.contains(transaction.getId()) || _inFlight.containsKey(transaction.getId()) || _isPending(transaction.getId()))
		{
			throw new PatchBusException(PatchBusException.Reason.VALIDATION_FAILED, "Duplicate transaction id " + transaction.getId());
		}
		if (transaction.patchCount() > _maxPatchesPerTransaction)
		{
			throw new PatchBusException(PatchBusException.Reason.TOO_MANY_PATCHES, transaction.patchCount() + " > " + _maxPatchesPerTransaction);
		}
		NamespaceId source = transaction.getSource();
		ResourceLimits limits = _namespaces.getLimits(source);
		if (null == limits)
		{
			throw new PatchBusException(PatchBusException.Reason.UNKNOWN_NAMESPACE, source + " is not registered");
		}
		if (_pending.size() >= _maxPendingTransactions)
		{
			throw new PatchBusException(PatchBusException.Reason.TOO_MANY_PENDING_TRANSACTIONS, _pending.size() + " transactions pending");
		}
		if (!ResourceLimits.within(limits.maxPendingTransactions(), _pendingFor(source) + 1))
		{
			throw new PatchBusException(PatchBusException.Reason.RESOURCE_LIMIT_EXCEEDED, source + " has too many pending transactions");
		}
		int patchesThisFrame = _patchesThisFrameByNamespace.getOrDefault(source, 0) + transaction.patchCount();
		if (!source.isKernel() && !ResourceLimits.within(limits.maxPatchesPerFrame(), patchesThisFrame))
		{
			throw new PatchBusException(PatchBusException.Reason.RESOURCE_LIMIT_EXCEEDED, source + " exceeded its patches per frame");
		}
		_validator.validate(transaction, limits);
		
		_patchesThisFrameByNamespace.put(source, patchesThisFrame);
		_patchesThisFrame += transaction.patchCount();
		_pending.add(new _Pending(transaction, _currentFrame, _arrivalCounter));
		_arrivalCounter += 1L;
		_submittedCount += 1L;
		_peakPending = Math.max(_peakPending, _pending.size());
	}

	private boolean _isPending(TransactionId id)
	{
		boolean found = false;
		for (_Pending pending : _pending)
		{
			if (id.equals(pending.transaction.getId()))
			{
				found = true;
				break;
			}
		}
		return found;
	}

	private int _pendingFor(NamespaceId source)
	{
		int count = 0;
		for (_Pending pending : _pending)
		{
			if (source.equals(pending.transaction.getSource()))
			{
				count += 1;
			}
		}
		return count;
	}


	private static class _Pending
	{
		public final Transaction transaction;
		public final long frameQueued;
		public final long arrival;
		public _Pending(Transaction transaction, long frameQueued, long arrival)
		{
			this.transaction = transaction;
			this.frameQueued = frameQueued;
			this.arrival = arrival;
		}
	}
}
