package com.jeffdisher.tessera.bus;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.jeffdisher.tessera.namespaces.CapabilityCheck;
import com.jeffdisher.tessera.namespaces.CapabilityChecker;
import com.jeffdisher.tessera.namespaces.CapabilityKind;
import com.jeffdisher.tessera.namespaces.EntityExport;
import com.jeffdisher.tessera.namespaces.NamespaceAccess;
import com.jeffdisher.tessera.namespaces.NamespaceManager;
import com.jeffdisher.tessera.namespaces.ResourceLimits;
import com.jeffdisher.tessera.patches.AssetPatch;
import com.jeffdisher.tessera.patches.CameraPatch;
import com.jeffdisher.tessera.patches.ComponentPatch;
import com.jeffdisher.tessera.patches.EntityPatch;
import com.jeffdisher.tessera.patches.HierarchyPatch;
import com.jeffdisher.tessera.patches.LayerPatch;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.transactions.Transaction;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.Value;
import com.jeffdisher.tessera.utils.Assert;


/**
 * The per-patch half of submission validation:  source, ownership/access, capabilities and projected resource
 * counts.  Either the whole transaction passes or the first failing patch is reported.
 * Transactions from KERNEL skip these checks.
 */
public class SubmissionValidator
{
	private final NamespaceManager _namespaces;
	private final CapabilityChecker _capabilities;

	public SubmissionValidator(NamespaceManager namespaces)
	{
		_namespaces = namespaces;
		_capabilities = namespaces.getCapabilities();
	}

	/**
	 * @param transaction The transaction to check (its source namespace is known to exist).
	 * @param limits The limits of the source namespace.
	 * @throws PatchBusException The first patch which can't be accepted.
	 */
	public void validate(Transaction transaction, ResourceLimits limits) throws PatchBusException
	{
		NamespaceId requester = transaction.getSource();
		for (Patch patch : transaction.getPatches())
		{
			_checkShape(patch);
		}
		if (requester.isKernel())
		{
			return;
		}
		_Projection projection = new _Projection(_namespaces.entityCount(requester), _namespaces.layerCount(requester), _namespaces.assetCount(requester));
		for (Patch patch : transaction.getPatches())
		{
			if (!requester.equals(patch.source()))
			{
				throw new PatchBusException(PatchBusException.Reason.SOURCE_MISMATCH, "Patch from " + patch.source() + " in transaction from " + requester);
			}
			switch (patch.getType())
			{
			case ENTITY:
				_checkEntity(requester, (EntityPatch)patch.kind(), limits, projection);
				break;
			case COMPONENT:
				ComponentPatch component = (ComponentPatch)patch.kind();
				_checkComponentWrite(requester, component.entity(), component.component());
				break;
			case LAYER:
				_checkLayer(requester, (LayerPatch)patch.kind(), limits, projection);
				break;
			case ASSET:
				_checkAsset(requester, (AssetPatch)patch.kind(), limits, projection);
				break;
			case HIERARCHY:
				_checkHierarchy(requester, (HierarchyPatch)patch.kind());
				break;
			case CAMERA:
				_checkComponentWrite(requester, ((CameraPatch)patch.kind()).entity(), CameraPatch.CAMERA_COMPONENT);
				break;
			default:
				throw Assert.unreachable();
			}
		}
	}


	// Rejects patches missing the fields their operation needs, before anything dereferences them.
	private static void _checkShape(Patch patch) throws PatchBusException
	{
		String problem = null;
		if ((null == patch) || (null == patch.kind()))
		{
			problem = "Missing patch";
		}
		else if (null == patch.source())
		{
			problem = "Patch without a source";
		}
		else
		{
			switch (patch.getType())
			{
			case ENTITY: {
				EntityPatch entity = (EntityPatch)patch.kind();
				if ((null == entity.entity()) || (null == entity.op()))
				{
					problem = "Entity patch without a target or operation";
				}
				else if (entity.components().containsValue(null))
				{
					problem = "Null component value creating " + entity.entity();
				}
				break;
			}
			case COMPONENT: {
				ComponentPatch component = (ComponentPatch)patch.kind();
				if ((null == component.entity()) || (null == component.component()) || (null == component.op()))
				{
					problem = "Component patch without a target, name or operation";
				}
				else if ((ComponentPatch.Op.SET == component.op()) && (null == component.data()))
				{
					problem = "Null data setting " + component.component() + " on " + component.entity();
				}
				else if ((ComponentPatch.Op.UPDATE == component.op()) && component.fields().containsValue(null))
				{
					problem = "Null field value updating " + component.component() + " on " + component.entity();
				}
				break;
			}
			case LAYER: {
				LayerPatch layer = (LayerPatch)patch.kind();
				if ((null == layer.layerId()) || (null == layer.op()))
				{
					problem = "Layer patch without an id or operation";
				}
				break;
			}
			case ASSET: {
				AssetPatch asset = (AssetPatch)patch.kind();
				if ((null == asset.assetId()) || (null == asset.op()))
				{
					problem = "Asset patch without an id or operation";
				}
				break;
			}
			case HIERARCHY: {
				HierarchyPatch hierarchy = (HierarchyPatch)patch.kind();
				if ((null == hierarchy.entity()) || (null == hierarchy.op()))
				{
					problem = "Hierarchy patch without a target or operation";
				}
				break;
			}
			case CAMERA: {
				CameraPatch camera = (CameraPatch)patch.kind();
				if ((null == camera.entity()) || (null == camera.op()))
				{
					problem = "Camera patch without a target or operation";
				}
				else if (null == camera.argument())
				{
					problem = "Camera patch without an argument for " + camera.entity();
				}
				break;
			}
			default:
				throw Assert.unreachable();
			}
		}
		if (null != problem)
		{
			throw new PatchBusException(PatchBusException.Reason.VALIDATION_FAILED, problem);
		}
	}

	private void _checkEntity(NamespaceId requester, EntityPatch patch, ResourceLimits limits, _Projection projection) throws PatchBusException
	{
		EntityRef entity = patch.entity();
		switch (patch.op())
		{
		case CREATE:
			_requireOwner(requester, entity, "create");
			if (!patch.replaceExisting() || !_namespaces.ownsEntity(entity))
			{
				_requireCapability(_capabilities.checkQuota(requester, CapabilityKind.CREATE_ENTITIES, projection.entities), "create entities");
				projection.entities += 1;
				_requireWithin(limits.maxEntities(), projection.entities, "entities");
			}
			for (Map.Entry<String, Value> elt : patch.components().entrySet())
			{
				_requireCapability(_capabilities.checkScoped(requester, CapabilityKind.MODIFY_COMPONENTS, elt.getKey()), "modify component " + elt.getKey());
			}
			break;
		case DESTROY:
			_requireOwner(requester, entity, "destroy");
			_requireCapability(_capabilities.check(requester, CapabilityKind.DESTROY_ENTITIES), "destroy entities");
			projection.entities = Math.max(0, projection.entities - 1);
			break;
		case ENABLE:
		case DISABLE:
			_requireAccess(_namespaces.checkComponentAccess(requester, entity, EntityExport.ALL_COMPONENTS, true), entity);
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _checkComponentWrite(NamespaceId requester, EntityRef entity, String component) throws PatchBusException
	{
		_requireAccess(_namespaces.checkComponentAccess(requester, entity, component, true), entity);
		_requireCapability(_capabilities.checkScoped(requester, CapabilityKind.MODIFY_COMPONENTS, component), "modify component " + component);
	}

	private void _checkHierarchy(NamespaceId requester, HierarchyPatch patch) throws PatchBusException
	{
		EntityRef entity = patch.entity();
		switch (patch.op())
		{
		case SET_PARENT:
		case REPARENT_CHILDREN:
			_requireAccess(_namespaces.checkComponentAccess(requester, entity, EntityExport.ALL_COMPONENTS, true), entity);
			if (null != patch.other())
			{
				// Attaching to an entity only requires being able to see it.
				_requireAccess(_namespaces.checkAccess(requester, patch.other().namespace(), patch.other().localId(), false), patch.other());
			}
			break;
		case REMOVE_PARENT:
		case DETACH_CHILDREN:
			_requireAccess(_namespaces.checkComponentAccess(requester, entity, EntityExport.ALL_COMPONENTS, true), entity);
			break;
		case DESPAWN_RECURSIVE:
			_requireOwner(requester, entity, "despawn");
			_requireCapability(_capabilities.check(requester, CapabilityKind.DESTROY_ENTITIES), "destroy entities");
			break;
		case SET_VISIBLE:
			_checkComponentWrite(requester, entity, HierarchyPatch.VISIBLE_COMPONENT);
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _checkLayer(NamespaceId requester, LayerPatch patch, ResourceLimits limits, _Projection projection) throws PatchBusException
	{
		String layerId = patch.layerId();
		NamespaceId owner = _namespaces.getLayerOwner(layerId);
		switch (patch.op())
		{
		case CREATE:
			if ((null != owner) && !owner.equals(requester))
			{
				throw new PatchBusException(PatchBusException.Reason.PERMISSION_DENIED, "Layer \"" + layerId + "\" is owned by " + owner);
			}
			if (null == owner)
			{
				_requireCapability(_capabilities.checkQuota(requester, CapabilityKind.CREATE_LAYERS, projection.layers), "create layers");
				projection.layers += 1;
				projection.createdLayers.add(layerId);
				_requireWithin(limits.maxLayers(), projection.layers, "layers");
			}
			break;
		case UPDATE:
		case DESTROY:
			boolean isOwn = requester.equals(owner) || ((null == owner) && projection.createdLayers.contains(layerId));
			if (!isOwn && (null != owner))
			{
				_requireCapability(_capabilities.checkScoped(requester, CapabilityKind.MODIFY_LAYERS, layerId), "modify layer " + layerId);
			}
			if (isOwn && (LayerPatch.Op.DESTROY == patch.op()))
			{
				projection.layers = Math.max(0, projection.layers - 1);
			}
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _checkAsset(NamespaceId requester, AssetPatch patch, ResourceLimits limits, _Projection projection) throws PatchBusException
	{
		String assetId = patch.assetId();
		NamespaceId owner = _namespaces.getAssetOwner(assetId);
		if ((null != owner) && !owner.equals(requester))
		{
			throw new PatchBusException(PatchBusException.Reason.PERMISSION_DENIED, "Asset \"" + assetId + "\" is owned by " + owner);
		}
		switch (patch.op())
		{
		case LOAD:
			if (null == patch.path())
			{
				throw new PatchBusException(PatchBusException.Reason.VALIDATION_FAILED, "Asset \"" + assetId + "\" has no path");
			}
			_requireCapability(_capabilities.checkScoped(requester, CapabilityKind.LOAD_ASSETS, patch.path()), "load " + patch.path());
			if (null == owner)
			{
				projection.assets += 1;
				_requireWithin(limits.maxAssets(), projection.assets, "assets");
			}
			break;
		case UNLOAD:
			if (null != owner)
			{
				projection.assets = Math.max(0, projection.assets - 1);
			}
			break;
		case UPDATE:
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private static void _requireOwner(NamespaceId requester, EntityRef entity, String action) throws PatchBusException
	{
		if (!requester.equals(entity.namespace()))
		{
			throw new PatchBusException(PatchBusException.Reason.PERMISSION_DENIED, requester + " cannot " + action + " " + entity);
		}
	}

	private static void _requireAccess(NamespaceAccess access, EntityRef entity) throws PatchBusException
	{
		if (!access.isAllowed())
		{
			throw new PatchBusException(PatchBusException.Reason.PERMISSION_DENIED, access + " for " + entity);
		}
	}

	private static void _requireCapability(CapabilityCheck check, String action) throws PatchBusException
	{
		switch (check)
		{
		case ALLOWED:
			break;
		case QUOTA_EXCEEDED:
			throw new PatchBusException(PatchBusException.Reason.RESOURCE_LIMIT_EXCEEDED, "Capability quota exceeded: " + action);
		case DENIED:
		case EXPIRED:
			throw new PatchBusException(PatchBusException.Reason.PERMISSION_DENIED, "Missing capability (" + check + "): " + action);
		default:
			throw Assert.unreachable();
		}
	}

	private static void _requireWithin(int limit, int projected, String what) throws PatchBusException
	{
		if (!ResourceLimits.within(limit, projected))
		{
			throw new PatchBusException(PatchBusException.Reason.RESOURCE_LIMIT_EXCEEDED, "Limit of " + limit + " " + what + " exceeded");
		}
	}


	private static class _Projection
	{
		public int entities;
		public int layers;
		public int assets;
		public final Set<String> createdLayers = new HashSet<>();
		public _Projection(int entities, int layers, int assets)
		{
			this.entities = entities;
			this.layers = layers;
			this.assets = assets;
		}
	}
}
