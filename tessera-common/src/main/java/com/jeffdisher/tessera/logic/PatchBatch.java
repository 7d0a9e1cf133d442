package com.jeffdisher.tessera.logic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.jeffdisher.tessera.patches.AssetPatch;
import com.jeffdisher.tessera.patches.ComponentPatch;
import com.jeffdisher.tessera.patches.EntityPatch;
import com.jeffdisher.tessera.patches.HierarchyPatch;
import com.jeffdisher.tessera.patches.IPatchKind;
import com.jeffdisher.tessera.patches.LayerPatch;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.patches.PatchKey;
import com.jeffdisher.tessera.transactions.Transaction;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.TransactionId;
import com.jeffdisher.tessera.types.Value;
import com.jeffdisher.tessera.utils.Assert;


/**
 * A mutable sequence of patches with the three rewrite passes used to shrink and order a batch before it is applied:
 * mergeRedundant(), eliminateContradictions() and sortOptimal() (normally run in that order, by BatchOptimizer).
 * Patches are only ever merged with patches from the same source.
 * A lifecycle run is a stretch of the batch within which no entity is destroyed and then used again.  The passes
 * only fold or reorder patches within a run, so an entity's DESTROY and later re-creation keep their place relative
 * to everything else targeting it.
 */
public class PatchBatch
{
	public static final int ORDER_CREATE = 0;
	public static final int ORDER_MODIFY = 2;
	public static final int ORDER_ASSET = 3;
	public static final int ORDER_DESTROY = 4;

	/**
	 * Determines where a patch sorts among patches of the same priority:  entity creation first, destruction last, so
	 * that everything else in the batch can see the entities it needs.
	 * 
	 * @param patch The patch.
	 * @return The sort order of its kind.
	 */
	public static int typeOrder(Patch patch)
	{
		IPatchKind kind = patch.kind();
		int order;
		switch (kind.getType())
		{
		case ENTITY:
			EntityPatch.Op op = ((EntityPatch)kind).op();
			if (EntityPatch.Op.CREATE == op)
			{
				order = ORDER_CREATE;
			}
			else if (EntityPatch.Op.DESTROY == op)
			{
				order = ORDER_DESTROY;
			}
			else
			{
				order = ORDER_MODIFY;
			}
			break;
		case COMPONENT:
		case LAYER:
		case HIERARCHY:
		case CAMERA:
			order = ORDER_MODIFY;
			break;
		case ASSET:
			order = ORDER_ASSET;
			break;
		default:
			throw Assert.unreachable();
		}
		return order;
	}

	/**
	 * Attempts to fold two patches with the same merge key into one patch with the same net effect.  The result takes
	 * the later patch's source and timestamp and the higher of the two priorities.
	 * 
	 * @param earlier The patch which would be applied first.
	 * @param later The patch which would be applied second.
	 * @return The combined patch, or null if the pair can't be combined.
	 */
	public static Patch merge(Patch earlier, Patch later)
	{
		if (!earlier.source().equals(later.source()))
		{
			return null;
		}
		IPatchKind kind;
		switch (earlier.getType())
		{
		case ENTITY:
			kind = _mergeEntity((EntityPatch)earlier.kind(), (EntityPatch)later.kind());
			break;
		case COMPONENT:
			kind = _mergeComponent((ComponentPatch)earlier.kind(), (ComponentPatch)later.kind());
			break;
		case LAYER:
			kind = _mergeLayer((LayerPatch)earlier.kind(), (LayerPatch)later.kind());
			break;
		case ASSET:
			kind = _mergeAsset((AssetPatch)earlier.kind(), (AssetPatch)later.kind());
			break;
		case HIERARCHY:
		case CAMERA:
			kind = null;
			break;
		default:
			throw Assert.unreachable();
		}
		return (null != kind)
				? new Patch(later.source(), kind, Math.max(earlier.priority(), later.priority()), later.timestamp())
				: null
		;
	}


	private final List<Patch> _patches;

	public PatchBatch()
	{
		_patches = new ArrayList<>();
	}

	public PatchBatch(Collection<Patch> patches)
	{
		_patches = new ArrayList<>(patches);
	}

	public void add(Patch patch)
	{
		_patches.add(patch);
	}

	public void addAll(Collection<Patch> patches)
	{
		_patches.addAll(patches);
	}

	public List<Patch> getPatches()
	{
		return Collections.unmodifiableList(_patches);
	}

	public int size()
	{
		return _patches.size();
	}

	public boolean isEmpty()
	{
		return _patches.isEmpty();
	}

	/**
	 * Stable-sorts by priority (descending) alone.  This is the order the patches would be applied in without any
	 * optimization, so the other passes work from it.
	 */
	public void sortByPriority()
	{
		_patches.sort(Comparator.comparingInt((Patch patch) -> patch.priority()).reversed());
	}

	/**
	 * Folds patches which write the same target.  Each target keeps the position of its first patch and patches
	 * without a merge key (hierarchy and camera) are kept as-is.
	 * Nothing is folded across a lifecycle run boundary.  A component write is not folded across a
	 * hierarchy or camera patch on the same entity and a DESTROY is not folded back over anything else touching its
	 * entity.
	 * 
	 * @return The number of patches removed by merging.
	 */
	public int mergeRedundant()
	{
		int[] runs = _lifecycleRuns(_patches);
		// Each slot is either a merge key's stack or a single unkeyed patch.
		List<List<Patch>> slots = new ArrayList<>();
		Map<PatchKey, Integer> slotsByKey = new HashMap<>();
		// The latest slot holding anything touching each entity and the latest holding an unkeyed patch touching it.
		Map<EntityRef, Integer> lastTouch = new HashMap<>();
		Map<EntityRef, Integer> lastUnkeyed = new HashMap<>();
		int currentRun = -1;
		int merged = 0;
		for (int i = 0; i < _patches.size(); ++i)
		{
			Patch patch = _patches.get(i);
			if (runs[i] != currentRun)
			{
				slotsByKey.clear();
				lastTouch.clear();
				lastUnkeyed.clear();
				currentRun = runs[i];
			}
			PatchKey key = PatchKey.forMerge(patch);
			Integer slot = (null != key) ? slotsByKey.get(key) : null;
			if ((null != slot) && !_canJoin(patch, slot, lastTouch, lastUnkeyed))
			{
				slot = null;
			}
			if (null == slot)
			{
				slot = slots.size();
				slots.add(new ArrayList<>());
				if (null != key)
				{
					slotsByKey.put(key, slot);
				}
			}
			List<Patch> stack = slots.get(slot);
			stack.add(patch);
			// Keep folding the top of the stack so that no two adjacent patches for a key could still be merged.
			while (stack.size() >= 2)
			{
				Patch combined = merge(stack.get(stack.size() - 2), stack.get(stack.size() - 1));
				if (null == combined)
				{
					break;
				}
				stack.remove(stack.size() - 1);
				stack.set(stack.size() - 1, combined);
				merged += 1;
			}
			int index = slot;
			for (EntityRef entity : _touchedEntities(patch))
			{
				lastTouch.merge(entity, index, (Integer old, Integer now) -> Math.max(old, now));
				if (null == key)
				{
					lastUnkeyed.merge(entity, index, (Integer old, Integer now) -> Math.max(old, now));
				}
			}
		}
		_patches.clear();
		for (List<Patch> stack : slots)
		{
			_patches.addAll(stack);
		}
		return merged;
	}

	/**
	 * Removes entities which are created and destroyed within the same lifecycle run:  if a run starts an entity with
	 * a plain CREATE and ends it with a DESTROY, every patch in that run targeting the entity is removed.  An entity
	 * named as the parent in a hierarchy patch of the run is left alone since its DESTROY also detaches children.
	 * 
	 * @return The number of patches removed.
	 */
	public int eliminateContradictions()
	{
		int[] runs = _lifecycleRuns(_patches);
		Set<Integer> removed = new HashSet<>();
		int start = 0;
		while (start < _patches.size())
		{
			int end = _endOfRun(runs, start);
			_eliminateInRun(start, end, removed);
			start = end;
		}
		
		List<Patch> kept = new ArrayList<>();
		for (int i = 0; i < _patches.size(); ++i)
		{
			if (!removed.contains(i))
			{
				kept.add(_patches.get(i));
			}
		}
		_patches.clear();
		_patches.addAll(kept);
		return removed.size();
	}

	/**
	 * Stable-sorts by priority (descending), then type order, then source namespace.  The type and namespace order
	 * only applies within each lifecycle run so no patch moves across an entity's DESTROY or re-creation.
	 */
	public void sortOptimal()
	{
		sortByPriority();
		int[] runs = _lifecycleRuns(_patches);
		List<Patch> sorted = new ArrayList<>();
		int start = 0;
		while (start < _patches.size())
		{
			int end = _endOfRun(runs, start);
			List<Patch> run = new ArrayList<>(_patches.subList(start, end));
			run.sort((Patch a, Patch b) -> {
				int compare = Integer.compare(b.priority(), a.priority());
				if (0 == compare)
				{
					compare = Integer.compare(typeOrder(a), typeOrder(b));
				}
				if (0 == compare)
				{
					compare = a.source().compareTo(b.source());
				}
				return compare;
			});
			sorted.addAll(run);
			start = end;
		}
		_patches.clear();
		_patches.addAll(sorted);
	}

	/**
	 * Packages the batch as a submitted transaction.
	 * 
	 * @param id The id of the new transaction.
	 * @param source The namespace the transaction is from.
	 * @param frame The frame the transaction is created in.
	 * @return A PENDING transaction containing these patches, in order.
	 */
	public Transaction intoTransaction(TransactionId id, NamespaceId source, long frame)
	{
		Transaction transaction = new Transaction(id, source, frame);
		for (Patch patch : _patches)
		{
			transaction.addPatch(patch);
		}
		transaction.submit();
		return transaction;
	}


	/**
	 * Splits the patches into runs which the passes may rewrite freely, returning the run number of each patch.  A new
	 * run starts at the first patch touching an entity destroyed earlier in the run and at a replacing CREATE of an
	 * entity the run already touched.  A recursive despawn sits in a run of its own since which entities it destroys
	 * is only known when it is applied.
	 */
	private static int[] _lifecycleRuns(List<Patch> patches)
	{
		int[] runs = new int[patches.size()];
		int run = 0;
		Set<EntityRef> touched = new HashSet<>();
		Set<EntityRef> ended = new HashSet<>();
		boolean afterDespawn = false;
		for (int i = 0; i < patches.size(); ++i)
		{
			Patch patch = patches.get(i);
			List<EntityRef> entities = _touchedEntities(patch);
			boolean isDespawn = _isDespawn(patch);
			boolean startsRun = afterDespawn || isDespawn;
			for (EntityRef entity : entities)
			{
				if (ended.contains(entity))
				{
					startsRun = true;
				}
			}
			if (_isOp(patch, EntityPatch.Op.CREATE) && ((EntityPatch)patch.kind()).replaceExisting() && touched.contains(patch.targetEntity()))
			{
				startsRun = true;
			}
			if (startsRun && (i > 0))
			{
				run += 1;
				touched.clear();
				ended.clear();
			}
			touched.addAll(entities);
			if (_isOp(patch, EntityPatch.Op.DESTROY) || isDespawn)
			{
				ended.add(patch.targetEntity());
			}
			afterDespawn = isDespawn;
			runs[i] = run;
		}
		return runs;
	}

	private static int _endOfRun(int[] runs, int start)
	{
		int end = start;
		while ((end < runs.length) && (runs[end] == runs[start]))
		{
			end += 1;
		}
		return end;
	}

	private void _eliminateInRun(int start, int end, Set<Integer> removed)
	{
		Map<EntityRef, List<Integer>> entityOps = new LinkedHashMap<>();
		Set<EntityRef> parents = new HashSet<>();
		for (int i = start; i < end; ++i)
		{
			IPatchKind kind = _patches.get(i).kind();
			if (kind instanceof EntityPatch)
			{
				entityOps.computeIfAbsent(((EntityPatch)kind).entity(), (EntityRef ignored) -> new ArrayList<>()).add(i);
			}
			else if ((kind instanceof HierarchyPatch) && (null != ((HierarchyPatch)kind).other()))
			{
				parents.add(((HierarchyPatch)kind).other());
			}
		}
		
		for (Map.Entry<EntityRef, List<Integer>> elt : entityOps.entrySet())
		{
			EntityRef entity = elt.getKey();
			List<Integer> indices = elt.getValue();
			Patch first = _patches.get(indices.get(0));
			Patch last = _patches.get(indices.get(indices.size() - 1));
			if (_isPlainCreate(first) && _isOp(last, EntityPatch.Op.DESTROY) && first.source().equals(last.source()) && !parents.contains(entity))
			{
				for (int i = start; i < end; ++i)
				{
					if (_patches.get(i).targetsEntity(entity))
					{
						removed.add(i);
					}
				}
			}
		}
	}

	private static boolean _canJoin(Patch patch, int slot, Map<EntityRef, Integer> lastTouch, Map<EntityRef, Integer> lastUnkeyed)
	{
		boolean canJoin;
		switch (patch.getType())
		{
		case COMPONENT:
			// Hierarchy and camera patches also write components.
			canJoin = lastUnkeyed.getOrDefault(patch.targetEntity(), -1) < slot;
			break;
		case ENTITY:
			canJoin = !_isOp(patch, EntityPatch.Op.DESTROY) || (lastTouch.getOrDefault(patch.targetEntity(), -1) <= slot);
			break;
		case LAYER:
		case ASSET:
			canJoin = true;
			break;
		default:
			// Hierarchy and camera patches have no merge key.
			throw Assert.unreachable();
		}
		return canJoin;
	}

	private static List<EntityRef> _touchedEntities(Patch patch)
	{
		List<EntityRef> entities = new ArrayList<>();
		EntityRef target = patch.targetEntity();
		if (null != target)
		{
			entities.add(target);
		}
		if ((patch.kind() instanceof HierarchyPatch) && (null != ((HierarchyPatch)patch.kind()).other()))
		{
			entities.add(((HierarchyPatch)patch.kind()).other());
		}
		return entities;
	}

	private static boolean _isDespawn(Patch patch)
	{
		return (patch.kind() instanceof HierarchyPatch) && (HierarchyPatch.Op.DESPAWN_RECURSIVE == ((HierarchyPatch)patch.kind()).op());
	}

	private static boolean _isOp(Patch patch, EntityPatch.Op op)
	{
		return (patch.kind() instanceof EntityPatch) && (op == ((EntityPatch)patch.kind()).op());
	}

	private static boolean _isPlainCreate(Patch patch)
	{
		return _isOp(patch, EntityPatch.Op.CREATE) && !((EntityPatch)patch.kind()).replaceExisting();
	}

	private static IPatchKind _mergeEntity(EntityPatch earlier, EntityPatch later)
	{
		IPatchKind result = null;
		switch (earlier.op())
		{
		case CREATE:
			if (EntityPatch.Op.ENABLE == later.op())
			{
				// Entities are created enabled.
				result = earlier;
			}
			break;
		case DESTROY:
			// Whatever follows a DESTROY belongs to a new lifecycle of the entity.
			break;
		case ENABLE:
		case DISABLE:
			if ((EntityPatch.Op.ENABLE == later.op()) || (EntityPatch.Op.DISABLE == later.op()) || (EntityPatch.Op.DESTROY == later.op()))
			{
				result = later;
			}
			break;
		default:
			throw Assert.unreachable();
		}
		return result;
	}

	private static IPatchKind _mergeComponent(ComponentPatch earlier, ComponentPatch later)
	{
		IPatchKind result = null;
		switch (later.op())
		{
		case SET:
		case REMOVE:
			// A full replacement or removal hides whatever came before.
			result = later;
			break;
		case UPDATE:
			if (ComponentPatch.Op.UPDATE == earlier.op())
			{
				Map<String, Value> union = new HashMap<>(earlier.fields());
				union.putAll(later.fields());
				result = ComponentPatch.update(later.entity(), later.component(), union);
			}
			else if (ComponentPatch.Op.SET == earlier.op())
			{
				Value data = earlier.data();
				result = (Value.Type.OBJECT == data.getType())
						? ComponentPatch.set(later.entity(), later.component(), data.withFields(later.fields()))
						: later
				;
			}
			// An UPDATE after a REMOVE must still fail, so it is not merged.
			break;
		default:
			throw Assert.unreachable();
		}
		return result;
	}

	private static IPatchKind _mergeLayer(LayerPatch earlier, LayerPatch later)
	{
		IPatchKind result = null;
		if (LayerPatch.Op.UPDATE == later.op())
		{
			if (LayerPatch.Op.DESTROY != earlier.op())
			{
				result = earlier.withFieldsFrom(later);
			}
		}
		else if ((LayerPatch.Op.DESTROY == later.op()) && (LayerPatch.Op.UPDATE == earlier.op()))
		{
			result = later;
		}
		return result;
	}

	private static IPatchKind _mergeAsset(AssetPatch earlier, AssetPatch later)
	{
		IPatchKind result = null;
		if (AssetPatch.Op.UPDATE == earlier.op())
		{
			if ((AssetPatch.Op.UPDATE == later.op()) || (AssetPatch.Op.UNLOAD == later.op()))
			{
				result = later;
			}
		}
		return result;
	}
}
