package com.jeffdisher.tessera.snapshots;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.tessera.types.SnapshotId;


/**
 * Keeps a bounded set of snapshots.  Whenever the count or the estimated memory exceeds its limit, the snapshot with
 * the lowest frame number is evicted (the most recently stored snapshot is always kept, even if it alone exceeds the
 * memory limit).
 * Synchronized since the console lists snapshots from its own thread.
 */
public class SnapshotManager
{
	private final int _maxSnapshots;
	private final long _maxMemory;
	private final Map<Long, StateSnapshot> _byId = new TreeMap<>();
	private long _memoryUsed;

	public SnapshotManager(int maxSnapshots, long maxMemory)
	{
		_maxSnapshots = maxSnapshots;
		_maxMemory = maxMemory;
	}

	/**
	 * Stores the snapshot and evicts older ones as needed.
	 * 
	 * @param snapshot The snapshot to keep.
	 * @return The ids of any snapshots evicted to make room.
	 */
	public synchronized List<SnapshotId> store(StateSnapshot snapshot)
	{
		StateSnapshot previous = _byId.put(snapshot.getId().value(), snapshot);
		if (null != previous)
		{
			_memoryUsed -= previous.memorySize();
		}
		_memoryUsed += snapshot.memorySize();
		
		List<SnapshotId> evicted = new ArrayList<>();
		while ((_byId.size() > 1) && ((_byId.size() > _maxSnapshots) || (_memoryUsed > _maxMemory)))
		{
			StateSnapshot oldest = _oldestExcept(snapshot.getId());
			_byId.remove(oldest.getId().value());
			_memoryUsed -= oldest.memorySize();
			evicted.add(oldest.getId());
		}
		return evicted;
	}

	public synchronized StateSnapshot get(SnapshotId id)
	{
		return _byId.get(id.value());
	}

	public synchronized StateSnapshot remove(SnapshotId id)
	{
		StateSnapshot removed = _byId.remove(id.value());
		if (null != removed)
		{
			_memoryUsed -= removed.memorySize();
		}
		return removed;
	}

	/**
	 * @return The snapshot with the highest frame number, or null if there are none.
	 */
	public synchronized StateSnapshot latest()
	{
		StateSnapshot latest = null;
		for (StateSnapshot snapshot : _byId.values())
		{
			if ((null == latest) || (snapshot.getFrame() >= latest.getFrame()))
			{
				latest = snapshot;
			}
		}
		return latest;
	}

	/**
	 * @return The stored snapshots, in id order.
	 */
	public synchronized List<StateSnapshot> list()
	{
		return new ArrayList<>(_byId.values());
	}

	public synchronized int size()
	{
		return _byId.size();
	}

	public synchronized long memoryUsed()
	{
		return _memoryUsed;
	}

	public synchronized void clear()
	{
		_byId.clear();
		_memoryUsed = 0L;
	}


	private StateSnapshot _oldestExcept(SnapshotId keep)
	{
		StateSnapshot oldest = null;
		for (StateSnapshot snapshot : _byId.values())
		{
			if (!snapshot.getId().equals(keep) && ((null == oldest) || (snapshot.getFrame() < oldest.getFrame())))
			{
				oldest = snapshot;
			}
		}
		return oldest;
	}
}
