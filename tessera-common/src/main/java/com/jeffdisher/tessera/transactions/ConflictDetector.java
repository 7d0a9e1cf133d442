package com.jeffdisher.tessera.transactions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.jeffdisher.tessera.patches.AssetPatch;
import com.jeffdisher.tessera.patches.ComponentPatch;
import com.jeffdisher.tessera.patches.IPatchKind;
import com.jeffdisher.tessera.patches.LayerPatch;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.utils.Assert;


/**
 * Tracks the targets claimed by transactions which have been accepted into the current batch, so that a later
 * transaction touching the same targets can be recognized.  This only detects conflicts:  it is up to the caller to
 * decide whether to defer or apply the conflicting transaction.
 * A whole-entity claim collides with any claim on the same entity, including component claims.
 * Not thread-safe:  only used on the kernel thread.
 */
public class ConflictDetector
{
	private final Set<EntityRef> _claimedEntities = new HashSet<>();
	private final Map<EntityRef, Set<String>> _claimedComponents = new HashMap<>();
	private final Set<String> _claimedLayers = new HashSet<>();
	private final Set<String> _claimedAssets = new HashSet<>();

	/**
	 * Claims every target of the transaction.
	 */
	public void addTransaction(Transaction transaction)
	{
		for (Patch patch : transaction.getPatches())
		{
			addPatch(patch);
		}
	}

	/**
	 * Claims the target of a single patch.
	 */
	public void addPatch(Patch patch)
	{
		Conflict target = targetOf(patch);
		switch (target.kind())
		{
		case ENTITY:
			_claimedEntities.add(target.entity());
			break;
		case COMPONENT:
			_claimedComponents.computeIfAbsent(target.entity(), (EntityRef ignored) -> new HashSet<>()).add(target.name());
			break;
		case LAYER:
			_claimedLayers.add(target.name());
			break;
		case ASSET:
			_claimedAssets.add(target.name());
			break;
		default:
			throw Assert.unreachable();
		}
	}

	public boolean hasConflict(Transaction transaction)
	{
		boolean found = false;
		for (Patch patch : transaction.getPatches())
		{
			if (_conflictsWith(targetOf(patch)))
			{
				found = true;
				break;
			}
		}
		return found;
	}

	/**
	 * @return The targets of the transaction which are already claimed, in patch order without duplicates.
	 */
	public List<Conflict> getConflicts(Transaction transaction)
	{
		Set<Conflict> conflicts = new LinkedHashSet<>();
		for (Patch patch : transaction.getPatches())
		{
			Conflict target = targetOf(patch);
			if (_conflictsWith(target))
			{
				conflicts.add(target);
			}
		}
		return new ArrayList<>(conflicts);
	}

	public int claimedCount()
	{
		int components = 0;
		for (Set<String> set : _claimedComponents.values())
		{
			components += set.size();
		}
		return _claimedEntities.size() + components + _claimedLayers.size() + _claimedAssets.size();
	}

	public void clear()
	{
		_claimedEntities.clear();
		_claimedComponents.clear();
		_claimedLayers.clear();
		_claimedAssets.clear();
	}

	/**
	 * @return The claim granularity of the given patch.
	 */
	public static Conflict targetOf(Patch patch)
	{
		IPatchKind kind = patch.kind();
		Conflict target;
		switch (kind.getType())
		{
		case ENTITY:
		case HIERARCHY:
		case CAMERA:
			target = Conflict.entity(kind.targetEntity());
			break;
		case COMPONENT:
			ComponentPatch component = (ComponentPatch)kind;
			target = Conflict.component(component.entity(), component.component());
			break;
		case LAYER:
			target = Conflict.layer(((LayerPatch)kind).layerId());
			break;
		case ASSET:
			target = Conflict.asset(((AssetPatch)kind).assetId());
			break;
		default:
			throw Assert.unreachable();
		}
		return target;
	}


	private boolean _conflictsWith(Conflict target)
	{
		boolean conflicts;
		switch (target.kind())
		{
		case ENTITY:
			conflicts = _claimedEntities.contains(target.entity()) || _claimedComponents.containsKey(target.entity());
			break;
		case COMPONENT:
			Set<String> components = _claimedComponents.get(target.entity());
			conflicts = _claimedEntities.contains(target.entity())
					|| ((null != components) && components.contains(target.name()))
			;
			break;
		case LAYER:
			conflicts = _claimedLayers.contains(target.name());
			break;
		case ASSET:
			conflicts = _claimedAssets.contains(target.name());
			break;
		default:
			throw Assert.unreachable();
		}
		return conflicts;
	}
}
