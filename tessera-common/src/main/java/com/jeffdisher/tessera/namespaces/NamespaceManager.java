package com.jeffdisher.tessera.namespaces;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.jeffdisher.tessera.logic.MonotonicIdAssigner;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.utils.Assert;


/**
 * The registry of namespaces:  their names, limits, owned entities/layers/assets and exports, and the access rules
 * between them.
 * Ownership of an entity is implied by its EntityRef's namespace, while layer and asset ids are global so their owner
 * is recorded here.
 * Lookups come from the kernel thread and from monitoring threads so all state is behind a read-write lock.
 */
public class NamespaceManager
{
	private final CapabilityChecker _capabilities;
	private final MonotonicIdAssigner _ids;
	private final ReentrantReadWriteLock _lock = new ReentrantReadWriteLock();
	private final Map<NamespaceId, _Namespace> _namespaces = new HashMap<>();
	private final Map<String, NamespaceId> _layerOwners = new HashMap<>();
	private final Map<String, NamespaceId> _assetOwners = new HashMap<>();

	/**
	 * Creates the manager with only the KERNEL namespace registered.
	 * 
	 * @param capabilities The capability store (revoked from when a namespace is destroyed).
	 * @param ids The assigner for new namespace ids (must never return 0, which is KERNEL).
	 */
	public NamespaceManager(CapabilityChecker capabilities, MonotonicIdAssigner ids)
	{
		_capabilities = capabilities;
		_ids = ids;
		_namespaces.put(NamespaceId.KERNEL, new _Namespace(NamespaceId.KERNEL, "kernel", ResourceLimits.UNLIMITED));
	}

	public CapabilityChecker getCapabilities()
	{
		return _capabilities;
	}

	/**
	 * Registers a new application namespace and grants it the default application capabilities.
	 * 
	 * @param name A human-readable name (not required to be unique).
	 * @param limits The quotas for the namespace.
	 * @return The id of the new namespace.
	 */
	public NamespaceId createNamespace(String name, ResourceLimits limits)
	{
		long raw = _ids.next();
		if (0L == raw)
		{
			raw = _ids.next();
		}
		NamespaceId id = new NamespaceId(raw);
		_lock.writeLock().lock();
		try
		{
			_namespaces.put(id, new _Namespace(id, name, limits));
		}
		finally
		{
			_lock.writeLock().unlock();
		}
		_capabilities.grantDefaultAppCapabilities(id);
		return id;
	}

	/**
	 * Removes a namespace, its ownership records and exports, and revokes all of its capabilities.  The entities,
	 * layers and assets themselves are not touched (the kernel despawns them first).
	 * 
	 * @param id The namespace to destroy.
	 * @return False if the namespace is unknown or is KERNEL (which can never be destroyed).
	 */
	public boolean destroyNamespace(NamespaceId id)
	{
		if (id.isKernel())
		{
			return false;
		}
		boolean didRemove;
		_lock.writeLock().lock();
		try
		{
			_Namespace removed = _namespaces.remove(id);
			didRemove = (null != removed);
			if (didRemove)
			{
				for (String layer : removed.layers)
				{
					_layerOwners.remove(layer);
				}
				for (String asset : removed.assets)
				{
					_assetOwners.remove(asset);
				}
				// Revoke while still holding the lock so that nothing can observe the namespace gone but its grants live.
				_capabilities.revokeAll(id);
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
		return didRemove;
	}

	public boolean exists(NamespaceId id)
	{
		_lock.readLock().lock();
		try
		{
			return _namespaces.containsKey(id);
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	/**
	 * @return A copy of the namespace's registration, or null if it doesn't exist.
	 */
	public NamespaceInfo getInfo(NamespaceId id)
	{
		_lock.readLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(id);
			return (null != namespace) ? namespace.freeze() : null;
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public List<NamespaceId> getNamespaceIds()
	{
		_lock.readLock().lock();
		try
		{
			List<NamespaceId> ids = new ArrayList<>(_namespaces.keySet());
			ids.sort(null);
			return ids;
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public ResourceLimits getLimits(NamespaceId id)
	{
		_lock.readLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(id);
			return (null != namespace) ? namespace.limits : null;
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public void registerEntity(EntityRef entity)
	{
		_lock.writeLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(entity.namespace());
			if (null != namespace)
			{
				namespace.entities.add(entity.localId());
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	/**
	 * Forgets an entity, including any export of it.
	 */
	public void unregisterEntity(EntityRef entity)
	{
		_lock.writeLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(entity.namespace());
			if (null != namespace)
			{
				namespace.entities.remove(entity.localId());
				namespace.exports.remove(entity.localId());
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	public void registerLayer(NamespaceId owner, String layerId)
	{
		_lock.writeLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(owner);
			if (null != namespace)
			{
				namespace.layers.add(layerId);
				_layerOwners.put(layerId, owner);
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	public void unregisterLayer(String layerId)
	{
		_lock.writeLock().lock();
		try
		{
			NamespaceId owner = _layerOwners.remove(layerId);
			_Namespace namespace = (null != owner) ? _namespaces.get(owner) : null;
			if (null != namespace)
			{
				namespace.layers.remove(layerId);
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	public void registerAsset(NamespaceId owner, String assetId)
	{
		_lock.writeLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(owner);
			if (null != namespace)
			{
				namespace.assets.add(assetId);
				_assetOwners.put(assetId, owner);
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	public void unregisterAsset(String assetId)
	{
		_lock.writeLock().lock();
		try
		{
			NamespaceId owner = _assetOwners.remove(assetId);
			_Namespace namespace = (null != owner) ? _namespaces.get(owner) : null;
			if (null != namespace)
			{
				namespace.assets.remove(assetId);
			}
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	/**
	 * @return The namespace which owns the layer, or null if no namespace does.
	 */
	public NamespaceId getLayerOwner(String layerId)
	{
		_lock.readLock().lock();
		try
		{
			return _layerOwners.get(layerId);
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	/**
	 * @return The namespace which owns the asset, or null if no namespace does.
	 */
	public NamespaceId getAssetOwner(String assetId)
	{
		_lock.readLock().lock();
		try
		{
			return _assetOwners.get(assetId);
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	/**
	 * Exports an entity the namespace owns.  This replaces any previous export of the same entity.
	 * 
	 * @param owner The namespace making the export.
	 * @param export The export (its localId must be a registered entity of owner).
	 * @return False if the namespace doesn't exist or doesn't own the entity.
	 */
	public boolean exportEntity(NamespaceId owner, EntityExport export)
	{
		_lock.writeLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(owner);
			boolean canExport = (null != namespace) && namespace.entities.contains(export.localId());
			if (canExport)
			{
				namespace.exports.put(export.localId(), export);
			}
			return canExport;
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	public boolean unexportEntity(NamespaceId owner, long localId)
	{
		_lock.writeLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(owner);
			return (null != namespace) && (null != namespace.exports.remove(localId));
		}
		finally
		{
			_lock.writeLock().unlock();
		}
	}

	/**
	 * Decides whether requester may read (or write) an entity of target.  Resolution order:  KERNEL, same namespace,
	 * unknown target, export, cross-namespace read capability (reads only).
	 * 
	 * @param requester The namespace asking.
	 * @param target The namespace owning the entity.
	 * @param localId The entity's local id within target.
	 * @param write True for a write, false for a read.
	 * @return The access decision.
	 */
	public NamespaceAccess checkAccess(NamespaceId requester, NamespaceId target, long localId, boolean write)
	{
		if (requester.isKernel() || requester.equals(target))
		{
			return NamespaceAccess.ALLOWED;
		}
		_lock.readLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(target);
			if (null == namespace)
			{
				return NamespaceAccess.DENIED_NOT_FOUND;
			}
			EntityExport export = namespace.exports.get(localId);
			if ((null != export) && _admits(export, requester))
			{
				if (!write || !export.writable().isEmpty())
				{
					return NamespaceAccess.ALLOWED;
				}
			}
			if (!write && _capabilities.checkCrossNamespaceRead(requester, target).isAllowed())
			{
				return NamespaceAccess.ALLOWED;
			}
			return (null != export)
					? NamespaceAccess.DENIED_NOT_OWNER
					: NamespaceAccess.DENIED_MISSING_CAPABILITY
			;
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	/**
	 * Like checkAccess() but also requires a foreign writer to be writing a component listed as writable in the export
	 * (ALL_COMPONENTS also matches).
	 */
	public NamespaceAccess checkComponentAccess(NamespaceId requester, EntityRef entity, String component, boolean write)
	{
		NamespaceAccess access = checkAccess(requester, entity.namespace(), entity.localId(), write);
		boolean isForeign = !requester.isKernel() && !requester.equals(entity.namespace());
		if (access.isAllowed() && isForeign)
		{
			_lock.readLock().lock();
			try
			{
				_Namespace namespace = _namespaces.get(entity.namespace());
				EntityExport export = (null != namespace) ? namespace.exports.get(entity.localId()) : null;
				if (null != export)
				{
					boolean permitted = write ? export.canWrite(component) : export.canRead(component);
					if (!permitted)
					{
						access = NamespaceAccess.DENIED_NOT_OWNER;
					}
				}
				// No export means the read came through a cross-namespace read capability, which covers all components.
			}
			finally
			{
				_lock.readLock().unlock();
			}
		}
		return access;
	}

	public int entityCount(NamespaceId id)
	{
		_lock.readLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(id);
			return (null != namespace) ? namespace.entities.size() : 0;
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public boolean ownsEntity(EntityRef entity)
	{
		_lock.readLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(entity.namespace());
			return (null != namespace) && namespace.entities.contains(entity.localId());
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public int layerCount(NamespaceId id)
	{
		_lock.readLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(id);
			return (null != namespace) ? namespace.layers.size() : 0;
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}

	public int assetCount(NamespaceId id)
	{
		_lock.readLock().lock();
		try
		{
			_Namespace namespace = _namespaces.get(id);
			return (null != namespace) ? namespace.assets.size() : 0;
		}
		finally
		{
			_lock.readLock().unlock();
		}
	}


	private boolean _admits(EntityExport export, NamespaceId requester)
	{
		ExportAccess access = export.access();
		boolean admits;
		switch (access.policy())
		{
		case PUBLIC:
			admits = true;
			break;
		case ALLOWLIST:
			admits = access.allowlist().contains(requester);
			break;
		case CAPABILITY_REQUIRED:
			admits = _capabilities.check(requester, access.requiredCapability()).isAllowed();
			break;
		default:
			throw Assert.unreachable();
		}
		return admits;
	}


	private static class _Namespace
	{
		public final NamespaceId id;
		public final String name;
		public final ResourceLimits limits;
		public final Set<Long> entities = new HashSet<>();
		public final Set<String> layers = new HashSet<>();
		public final Set<String> assets = new HashSet<>();
		public final Map<Long, EntityExport> exports = new HashMap<>();
		public _Namespace(NamespaceId id, String name, ResourceLimits limits)
		{
			this.id = id;
			this.name = name;
			this.limits = limits;
		}
		public NamespaceInfo freeze()
		{
			return new NamespaceInfo(this.id
					, this.name
					, this.limits
					, Set.copyOf(this.entities)
					, Set.copyOf(this.layers)
					, Set.copyOf(this.assets)
					, Map.copyOf(this.exports)
			);
		}
	}
}
