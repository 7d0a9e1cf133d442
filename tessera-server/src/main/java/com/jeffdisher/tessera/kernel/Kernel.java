package com.jeffdisher.tessera.kernel;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

import com.jeffdisher.tessera.bus.NamespaceHandle;
import com.jeffdisher.tessera.bus.PatchBus;
import com.jeffdisher.tessera.config.KernelConfig;
import com.jeffdisher.tessera.logic.BatchOptimizer;
import com.jeffdisher.tessera.logic.MonotonicIdAssigner;
import com.jeffdisher.tessera.namespaces.CapabilityChecker;
import com.jeffdisher.tessera.namespaces.CapabilityGrant;
import com.jeffdisher.tessera.namespaces.NamespaceInfo;
import com.jeffdisher.tessera.namespaces.NamespaceManager;
import com.jeffdisher.tessera.namespaces.ResourceLimits;
import com.jeffdisher.tessera.patches.AssetPatch;
import com.jeffdisher.tessera.patches.EntityPatch;
import com.jeffdisher.tessera.patches.LayerPatch;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.snapshots.SnapshotManager;
import com.jeffdisher.tessera.snapshots.StateSnapshot;
import com.jeffdisher.tessera.transactions.ConflictDetector;
import com.jeffdisher.tessera.transactions.Transaction;
import com.jeffdisher.tessera.types.CapabilityId;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.SnapshotId;
import com.jeffdisher.tessera.world.AssetRegistry;
import com.jeffdisher.tessera.world.IWorld;
import com.jeffdisher.tessera.world.LayerManager;


/**
 * The top of the mutation kernel:  it owns the bus, the namespace and capability registries, the layer and asset
 * stores and the snapshot history, and runs the frame loop over a world supplied by the caller.
 * A frame is:  beginFrame(), processTransactions(), endFrame().  All of these (and the snapshot/rollback and namespace
 * lifecycle calls) must be made from the same thread.  Applications only talk to the kernel through NamespaceHandles,
 * which are safe to use from any thread.
 */
public class Kernel
{
	/**
	 * Captures which are only used for comparison are never stored so they get an id no stored snapshot can have.
	 */
	public static final SnapshotId TRANSIENT_SNAPSHOT = new SnapshotId(-1L);

	private final KernelConfig _config;
	private final LongSupplier _currentTimeMillisProvider;
	private final MonotonicIdAssigner _transactionIds;
	private final MonotonicIdAssigner _snapshotIds;
	private final CapabilityChecker _capabilities;
	private final NamespaceManager _namespaces;
	private final PatchBus _bus;
	private final PatchApplicator _applicator;
	private final LayerManager _layers;
	private final AssetRegistry _assets;
	private final SnapshotManager _snapshots;

	private long _frame;
	private double _totalTime;
	private long _conflictCount;
	private long _deferredCount;

	public Kernel(KernelConfig config, LongSupplier currentTimeMillisProvider)
	{
		_config = config;
		_currentTimeMillisProvider = currentTimeMillisProvider;
		_transactionIds = new MonotonicIdAssigner(1L);
		_snapshotIds = new MonotonicIdAssigner(1L);
		_capabilities = new CapabilityChecker(new MonotonicIdAssigner(1L), currentTimeMillisProvider);
		_namespaces = new NamespaceManager(_capabilities, new MonotonicIdAssigner(1L));
		_bus = new PatchBus(config, _namespaces, _transactionIds);
		_applicator = new PatchApplicator(_namespaces, config.optimizeTransactions ? new BatchOptimizer() : null);
		_layers = new LayerManager();
		_assets = new AssetRegistry();
		_snapshots = new SnapshotManager(config.maxSnapshots, config.maxSnapshotMemory);
	}

	/**
	 * Creates a namespace with the default application capabilities.
	 */
	public NamespaceId registerNamespace(String name, ResourceLimits limits)
	{
		return _namespaces.createNamespace(name, limits);
	}

	/**
	 * @return A new handle for submitting into the namespace, or null if it doesn't exist.
	 */
	public NamespaceHandle createHandle(NamespaceId namespace)
	{
		return _bus.createHandle(namespace);
	}

	public CapabilityId grantCapability(NamespaceId holder, NamespaceId grantor, CapabilityGrant grant)
	{
		return _capabilities.grant(holder, grantor, grant);
	}

	/**
	 * Destroys a namespace:  everything it owns is removed from the world (with kernel authority, as one
	 * transaction), its handles are closed, its pending transactions are dropped and its capabilities are revoked.
	 *
	 * @param namespace The namespace to destroy.
	 * @param world The world holding its entities.
	 * @return False if the namespace is the kernel or doesn't exist.
	 */
	public boolean destroyNamespace(NamespaceId namespace, IWorld world)
	{
		NamespaceInfo info = namespace.isKernel() ? null : _namespaces.getInfo(namespace);
		if (null == info)
		{
			return false;
		}

		List<Patch> patches = new ArrayList<>();
		for (EntityRef ref : world.entities())
		{
			if (namespace.equals(ref.namespace()))
			{
				patches.add(Patch.of(NamespaceId.KERNEL, EntityPatch.destroy(ref)));
			}
		}
		for (String layerId : info.layers())
		{
			patches.add(Patch.of(NamespaceId.KERNEL, LayerPatch.destroy(layerId)));
		}
		for (String assetId : info.assets())
		{
			patches.add(Patch.of(NamespaceId.KERNEL, AssetPatch.unload(assetId)));
		}
		if (!patches.isEmpty())
		{
			ApplyResult result = applyKernelTransaction(patches, "destroy " + namespace, world);
			if (!result.success())
			{
				System.out.println("WARNING:  Cleanup of " + namespace + " failed: " + result.error());
			}
		}
		int dropped = _bus.removeNamespace(namespace);
		if (dropped > 0)
		{
			System.out.println("WARNING:  Dropped " + dropped + " pending transactions of " + namespace);
		}
		return _namespaces.destroyNamespace(namespace);
	}

	/**
	 * Starts the next frame.
	 *
	 * @param deltaTime The seconds since the last frame (clamped to [0, max_delta_time]).
	 * @return The context of the new frame.
	 */
	public FrameContext beginFrame(float deltaTime)
	{
		float clamped = Math.max(0.0f, Math.min(deltaTime, _config.maxDeltaTime));
		_frame += 1L;
		_totalTime += clamped;
		_capabilities.pruneExpired();
		_bus.beginFrame(_frame);
		return new FrameContext(_frame, clamped, _totalTime);
	}

	/**
	 * Applies every transaction which is ready this frame, in priority order.
	 * A transaction conflicting with one already applied this frame is either applied anyway (the conflict is only
	 * counted) or pushed back to the next frame, depending on defer_conflicting_transactions.
	 *
	 * @param world The world to mutate.
	 * @return The outcome of each transaction applied, in application order.
	 */
	public List<ApplyResult> processTransactions(IWorld world)
	{
		List<Transaction> ready = _bus.drainReady(_frame);
		ConflictDetector detector = new ConflictDetector();
		List<ApplyResult> results = new ArrayList<>();
		for (Transaction transaction : ready)
		{
			if (detector.hasConflict(transaction))
			{
				_conflictCount += 1L;
				if (_config.deferConflictingTransactions)
				{
					_bus.requeue(transaction);
					_deferredCount += 1L;
					continue;
				}
			}
			detector.addTransaction(transaction);
			results.add(_applyAndCommit(transaction, world));
		}
		return results;
	}

	/**
	 * Finishes the frame, trimming the commit log.
	 */
	public void endFrame()
	{
		_bus.gcCommitted(_config.commitLogKeep);
	}

	/**
	 * Captures and stores the current state.  Older snapshots may be evicted to stay within the limits.
	 */
	public StateSnapshot takeSnapshot(IWorld world)
	{
		StateSnapshot snapshot = StateSnapshot.capture(new SnapshotId(_snapshotIds.next()), _frame, world, _layers, _assets);
		_snapshots.store(snapshot);
		return snapshot;
	}

	/**
	 * Returns the world to the state captured in a stored snapshot.  This is done by applying the difference between
	 * the current state and the snapshot as one kernel transaction, so it is atomic.
	 *
	 * @param snapshotId The snapshot to return to.
	 * @param world The world to restore.
	 * @return The outcome, or null if the snapshot isn't stored.
	 */
	public ApplyResult rollbackTo(SnapshotId snapshotId, IWorld world)
	{
		StateSnapshot target = _snapshots.get(snapshotId);
		if (null == target)
		{
			return null;
		}
		StateSnapshot current = StateSnapshot.capture(TRANSIENT_SNAPSHOT, _frame, world, _layers, _assets);
		List<Patch> patches = target.diff(current);
		return applyKernelTransaction(patches, "rollback to " + snapshotId, world);
	}

	/**
	 * Applies patches immediately, with kernel authority and outside the bus queue.  The transaction is still
	 * recorded in the commit log so others can depend on it.
	 */
	public ApplyResult applyKernelTransaction(List<Patch> patches, String description, IWorld world)
	{
		Transaction transaction = new Transaction(_bus.nextTransactionId(), NamespaceId.KERNEL, _frame);
		for (Patch patch : patches)
		{
			transaction.addPatch(patch);
		}
		transaction.setDescription(description);
		transaction.submit();
		return _applyAndCommit(transaction, world);
	}

	public KernelStats stats(IWorld world)
	{
		return new KernelStats(_frame
				, _bus.stats()
				, _conflictCount
				, _deferredCount
				, _namespaces.getNamespaceIds().size()
				, world.entityCount()
				, _layers.count()
				, _assets.count()
				, _snapshots.size()
				, _snapshots.memoryUsed()
		);
	}

	public long getCurrentFrame()
	{
		return _frame;
	}

	public double getTotalTime()
	{
		return _totalTime;
	}

	public KernelConfig getConfig()
	{
		return _config;
	}

	public PatchBus getBus()
	{
		return _bus;
	}

	public NamespaceManager getNamespaces()
	{
		return _namespaces;
	}

	public CapabilityChecker getCapabilities()
	{
		return _capabilities;
	}

	public LayerManager getLayers()
	{
		return _layers;
	}

	public AssetRegistry getAssets()
	{
		return _assets;
	}

	public SnapshotManager getSnapshots()
	{
		return _snapshots;
	}

	public long currentTimeMillis()
	{
		return _currentTimeMillisProvider.getAsLong();
	}


	private ApplyResult _applyAndCommit(Transaction transaction, IWorld world)
	{
		transaction.beginApplying();
		ApplyResult result = _applicator.apply(transaction, world, _layers, _assets);
		if (result.success())
		{
			transaction.markCommitted(_frame);
		}
		else
		{
			transaction.markRolledBack(_frame);
			System.out.println("WARNING:  Rolled back " + transaction + ": " + result.error());
		}
		_bus.commit(result.toTransactionResult());
		return result;
	}
}
