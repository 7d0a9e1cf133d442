package com.jeffdisher.tessera.world;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.utils.Assert;


/**
 * An in-memory IWorld which stores entities in a generational-index arena:  records live in a growable slot array,
 * freed slots are reused, and each reuse bumps the slot's generation so that an EntityHandle to a destroyed entity
 * can never resolve to whatever took its place.
 * Not thread-safe.
 */
public class ArenaWorld implements IWorld
{
	private static final Comparator<EntityRef> REF_ORDER = Comparator.comparing(EntityRef::namespace).thenComparingLong(EntityRef::localId);

	private final List<_Slot> _slots = new ArrayList<>();
	private final ArrayDeque<Integer> _freeSlots = new ArrayDeque<>();
	private final Map<EntityRef, EntityHandle> _handles = new HashMap<>();

	/**
	 * @return The current handle of the entity, or null if it doesn't exist.
	 */
	public EntityHandle handleOf(EntityRef ref)
	{
		return _handles.get(ref);
	}

	/**
	 * @return The record the handle refers to, or null if that entity has since been destroyed.
	 */
	public EntityRecord resolve(EntityHandle handle)
	{
		EntityRecord record = null;
		if ((handle.index() >= 0) && (handle.index() < _slots.size()))
		{
			_Slot slot = _slots.get(handle.index());
			if (slot.generation == handle.generation())
			{
				record = slot.record;
			}
		}
		return record;
	}

	/**
	 * @return The number of slots allocated (live or free).
	 */
	public int capacity()
	{
		return _slots.size();
	}

	@Override
	public boolean contains(EntityRef ref)
	{
		return _handles.containsKey(ref);
	}

	@Override
	public EntityRecord get(EntityRef ref)
	{
		EntityHandle handle = _handles.get(ref);
		return (null != handle) ? resolve(handle) : null;
	}

	@Override
	public boolean insert(EntityRecord record)
	{
		if (_handles.containsKey(record.ref()))
		{
			return false;
		}
		int index;
		_Slot slot;
		if (_freeSlots.isEmpty())
		{
			index = _slots.size();
			slot = new _Slot();
			_slots.add(slot);
		}
		else
		{
			index = _freeSlots.removeFirst();
			slot = _slots.get(index);
		}
		Assert.assertTrue(null == slot.record);
		slot.record = record;
		_handles.put(record.ref(), new EntityHandle(index, slot.generation));
		return true;
	}

	@Override
	public boolean replace(EntityRecord record)
	{
		EntityHandle handle = _handles.get(record.ref());
		if (null == handle)
		{
			return false;
		}
		_slots.get(handle.index()).record = record;
		return true;
	}

	@Override
	public EntityRecord destroy(EntityRef ref)
	{
		EntityHandle handle = _handles.remove(ref);
		EntityRecord removed = null;
		if (null != handle)
		{
			_Slot slot = _slots.get(handle.index());
			removed = slot.record;
			slot.record = null;
			slot.generation += 1;
			_freeSlots.addLast(handle.index());
		}
		return removed;
	}

	@Override
	public List<EntityRef> entities()
	{
		List<EntityRef> refs = new ArrayList<>(_handles.keySet());
		refs.sort(REF_ORDER);
		return refs;
	}

	@Override
	public List<EntityRef> childrenOf(EntityRef parent)
	{
		List<EntityRef> children = new ArrayList<>();
		for (_Slot slot : _slots)
		{
			if ((null != slot.record) && parent.equals(slot.record.parent()))
			{
				children.add(slot.record.ref());
			}
		}
		children.sort(REF_ORDER);
		return children;
	}

	@Override
	public int entityCount()
	{
		return _handles.size();
	}


	/**
	 * A direct reference into the arena, valid until the entity is destroyed.
	 */
	public static record EntityHandle(int index, int generation)
	{
	}

	private static class _Slot
	{
		public int generation;
		public EntityRecord record;
	}
}
