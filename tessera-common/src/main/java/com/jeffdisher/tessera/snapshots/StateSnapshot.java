package com.jeffdisher.tessera.snapshots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.jeffdisher.tessera.patches.AssetPatch;
import com.jeffdisher.tessera.patches.ComponentPatch;
import com.jeffdisher.tessera.patches.EntityPatch;
import com.jeffdisher.tessera.patches.HierarchyPatch;
import com.jeffdisher.tessera.patches.IPatchKind;
import com.jeffdisher.tessera.patches.LayerPatch;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.SnapshotId;
import com.jeffdisher.tessera.types.Value;
import com.jeffdisher.tessera.world.AssetRegistry;
import com.jeffdisher.tessera.world.AssetState;
import com.jeffdisher.tessera.world.EntityRecord;
import com.jeffdisher.tessera.world.IWorld;
import com.jeffdisher.tessera.world.LayerManager;
import com.jeffdisher.tessera.world.LayerState;


/**
 * An immutable capture of all world state at the end of a frame, used to compute the patches which restore it.
 */
public class StateSnapshot
{
	/**
	 * Captures the current state.
	 * 
	 * @param id The id of the new snapshot.
	 * @param frame The frame number the state belongs to.
	 * @param world The entity store.
	 * @param layers The layer store.
	 * @param assets The asset store.
	 * @return The new snapshot.
	 */
	public static StateSnapshot capture(SnapshotId id, long frame, IWorld world, LayerManager layers, AssetRegistry assets)
	{
		Map<EntityRef, EntityEntry> entities = new LinkedHashMap<>();
		Map<EntityRef, Map<String, Value>> components = new LinkedHashMap<>();
		for (EntityRef ref : world.entities())
		{
			EntityRecord record = world.get(ref);
			entities.put(ref, new EntityEntry(record.archetype(), record.enabled(), record.parent()));
			components.put(ref, record.components());
		}
		Map<String, LayerState> layerMap = new TreeMap<>();
		for (LayerState layer : layers.all())
		{
			layerMap.put(layer.id(), layer);
		}
		Map<String, AssetState> assetMap = new TreeMap<>();
		for (AssetState asset : assets.all())
		{
			assetMap.put(asset.id(), asset);
		}
		return new StateSnapshot(id, frame, entities, components, layerMap, assetMap);
	}


	private final SnapshotId _id;
	private final long _frame;
	private final Map<EntityRef, EntityEntry> _entities;
	private final Map<EntityRef, Map<String, Value>> _components;
	private final Map<String, LayerState> _layers;
	private final Map<String, AssetState> _assets;
	private final long _memorySize;

	public StateSnapshot(SnapshotId id
			, long frame
			, Map<EntityRef, EntityEntry> entities
			, Map<EntityRef, Map<String, Value>> components
			, Map<String, LayerState> layers
			, Map<String, AssetState> assets
	)
	{
		_id = id;
		_frame = frame;
		_entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
		_components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
		_layers = Collections.unmodifiableMap(new TreeMap<>(layers));
		_assets = Collections.unmodifiableMap(new TreeMap<>(assets));
		_memorySize = _estimateSize();
	}

	public SnapshotId getId()
	{
		return _id;
	}

	public long getFrame()
	{
		return _frame;
	}

	public Map<EntityRef, EntityEntry> getEntities()
	{
		return _entities;
	}

	public Map<EntityRef, Map<String, Value>> getComponents()
	{
		return _components;
	}

	public Map<String, LayerState> getLayers()
	{
		return _layers;
	}

	public Map<String, AssetState> getAssets()
	{
		return _assets;
	}

	/**
	 * @return A rough estimate of the heap retained by this snapshot.
	 */
	public long memorySize()
	{
		return _memorySize;
	}

	/**
	 * Compares the observable state of two snapshots (ids, frames and asset version counters are ignored).
	 */
	public boolean sameStateAs(StateSnapshot other)
	{
		boolean same = _entities.equals(other._entities)
				&& _components.equals(other._components)
				&& _layers.equals(other._layers)
				&& (_assets.size() == other._assets.size());
		if (same)
		{
			for (Map.Entry<String, AssetState> elt : _assets.entrySet())
			{
				AssetState mine = elt.getValue();
				AssetState theirs = other._assets.get(elt.getKey());
				if ((null == theirs)
						|| !mine.owner().equals(theirs.owner())
						|| !Objects.equals(mine.path(), theirs.path())
						|| !Objects.equals(mine.assetType(), theirs.assetType())
						|| !Objects.equals(mine.data(), theirs.data())
				)
				{
					same = false;
					break;
				}
			}
		}
		return same;
	}

	/**
	 * Computes the patches which turn the state captured in "from" into the state captured in this snapshot.
	 * Each patch is sourced from the namespace owning what it touches, so the list is meant to be applied as a single
	 * KERNEL transaction.  Order:  entity creation, entity flags, components, hierarchy (parent removals before
	 * assignments so no intermediate cycle is possible), layers, assets, and entity destruction last.
	 * 
	 * @param from The state to transform.
	 * @return The patches, in application order.
	 */
	public List<Patch> diff(StateSnapshot from)
	{
		List<Patch> creates = new ArrayList<>();
		List<Patch> flags = new ArrayList<>();
		List<Patch> components = new ArrayList<>();
		List<Patch> unparents = new ArrayList<>();
		List<Patch> parents = new ArrayList<>();
		List<Patch> destroys = new ArrayList<>();
		
		for (Map.Entry<EntityRef, EntityEntry> elt : _entities.entrySet())
		{
			EntityRef ref = elt.getKey();
			EntityEntry target = elt.getValue();
			EntityEntry current = from._entities.get(ref);
			NamespaceId owner = ref.namespace();
			Map<String, Value> targetComponents = _components.get(ref);
			EntityRef currentParent;
			if ((null == current) || !Objects.equals(current.archetype(), target.archetype()))
			{
				// New entity (or one which changed archetype, which we replace).
				EntityPatch create = EntityPatch.create(ref, target.archetype(), targetComponents);
				if (null != current)
				{
					create = create.asReplacement();
				}
				creates.add(_patch(owner, create));
				if (!target.enabled())
				{
					flags.add(_patch(owner, EntityPatch.disable(ref)));
				}
				currentParent = null;
			}
			else
			{
				if (current.enabled() != target.enabled())
				{
					flags.add(_patch(owner, target.enabled() ? EntityPatch.enable(ref) : EntityPatch.disable(ref)));
				}
				Map<String, Value> currentComponents = from._components.get(ref);
				for (Map.Entry<String, Value> component : targetComponents.entrySet())
				{
					if (!component.getValue().equals(currentComponents.get(component.getKey())))
					{
						components.add(_patch(owner, ComponentPatch.set(ref, component.getKey(), component.getValue())));
					}
				}
				for (String name : currentComponents.keySet())
				{
					if (!targetComponents.containsKey(name))
					{
						components.add(_patch(owner, ComponentPatch.remove(ref, name)));
					}
				}
				currentParent = current.parent();
			}
			
			if (!Objects.equals(currentParent, target.parent()))
			{
				if (null != currentParent)
				{
					unparents.add(_patch(owner, HierarchyPatch.removeParent(ref)));
				}
				if (null != target.parent())
				{
					parents.add(_patch(owner, HierarchyPatch.setParent(ref, target.parent())));
				}
			}
		}
		for (EntityRef ref : from._entities.keySet())
		{
			if (!_entities.containsKey(ref))
			{
				destroys.add(_patch(ref.namespace(), EntityPatch.destroy(ref)));
			}
		}
		
		List<Patch> patches = new ArrayList<>();
		patches.addAll(creates);
		patches.addAll(flags);
		patches.addAll(components);
		patches.addAll(unparents);
		patches.addAll(parents);
		_diffLayers(from, patches);
		_diffAssets(from, patches);
		patches.addAll(destroys);
		return patches;
	}


	private void _diffLayers(StateSnapshot from, List<Patch> out)
	{
		for (LayerState target : _layers.values())
		{
			LayerState current = from._layers.get(target.id());
			boolean mustCreate = (null == current);
			if ((null != current) && ((current.layerType() != target.layerType()) || !current.owner().equals(target.owner())))
			{
				out.add(_patch(current.owner(), LayerPatch.destroy(current.id())));
				mustCreate = true;
			}
			if (mustCreate)
			{
				out.add(_patch(target.owner(), new LayerPatch(target.id(), LayerPatch.Op.CREATE, target.layerType(), target.priority(), target.visible(), target.blendMode())));
			}
			else if ((current.priority() != target.priority()) || (current.visible() != target.visible()) || (current.blendMode() != target.blendMode()))
			{
				out.add(_patch(target.owner(), LayerPatch.update(target.id(), target.priority(), target.visible(), target.blendMode())));
			}
		}
		for (LayerState current : from._layers.values())
		{
			if (!_layers.containsKey(current.id()))
			{
				out.add(_patch(current.owner(), LayerPatch.destroy(current.id())));
			}
		}
	}

	private void _diffAssets(StateSnapshot from, List<Patch> out)
	{
		for (AssetState target : _assets.values())
		{
			AssetState current = from._assets.get(target.id());
			boolean mustLoad = (null == current);
			if ((null != current)
					&& (!current.owner().equals(target.owner())
							|| !Objects.equals(current.path(), target.path())
							|| !Objects.equals(current.assetType(), target.assetType())
					)
			)
			{
				out.add(_patch(current.owner(), AssetPatch.unload(current.id())));
				mustLoad = true;
			}
			if (mustLoad)
			{
				out.add(_patch(target.owner(), AssetPatch.load(target.id(), target.path(), target.assetType())));
				if (null != target.data())
				{
					out.add(_patch(target.owner(), AssetPatch.update(target.id(), target.data())));
				}
			}
			else if (!Objects.equals(current.data(), target.data()))
			{
				// A null target clears the data.
				out.add(_patch(target.owner(), AssetPatch.update(target.id(), target.data())));
			}
		}
		for (AssetState current : from._assets.values())
		{
			if (!_assets.containsKey(current.id()))
			{
				out.add(_patch(current.owner(), AssetPatch.unload(current.id())));
			}
		}
	}

	private static Patch _patch(NamespaceId source, IPatchKind kind)
	{
		return new Patch(source, kind, 0, 0L);
	}

	private long _estimateSize()
	{
		// Rough per-object overheads:  we only need this to be proportional, for eviction.
		long size = 64L;
		for (Map.Entry<EntityRef, Map<String, Value>> elt : _components.entrySet())
		{
			size += 64L;
			for (Map.Entry<String, Value> component : elt.getValue().entrySet())
			{
				size += 32L + 2L * component.getKey().length() + component.getValue().estimatedSize();
			}
		}
		size += 96L * _layers.size();
		for (AssetState asset : _assets.values())
		{
			size += 96L + ((null != asset.path()) ? 2L * asset.path().length() : 0L);
			if (null != asset.data())
			{
				size += asset.data().estimatedSize();
			}
		}
		return size;
	}


	/**
	 * The captured per-entity state other than its components.
	 */
	public static record EntityEntry(String archetype, boolean enabled, EntityRef parent)
	{
	}
}
