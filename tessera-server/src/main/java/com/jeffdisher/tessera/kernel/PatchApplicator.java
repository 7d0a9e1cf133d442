package com.jeffdisher.tessera.kernel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.tessera.logic.BatchOptimizer;
import com.jeffdisher.tessera.namespaces.NamespaceManager;
import com.jeffdisher.tessera.patches.AssetPatch;
import com.jeffdisher.tessera.patches.BlendMode;
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
import com.jeffdisher.tessera.world.AssetRegistry;
import com.jeffdisher.tessera.world.AssetState;
import com.jeffdisher.tessera.world.EntityRecord;
import com.jeffdisher.tessera.world.IWorld;
import com.jeffdisher.tessera.world.LayerManager;
import com.jeffdisher.tessera.world.LayerState;


/**
 * Applies a transaction's patches to the world, all or nothing.
 * Before each change, the prior state of whatever is touched is written to an undo journal.  If any patch fails,
 * the journal is replayed in reverse so the world, layers and assets are exactly as they were before the transaction.
 * Ownership changes in the NamespaceManager are only published once the whole transaction has succeeded.
 */
public class PatchApplicator
{
	private final NamespaceManager _namespaces;
	private final BatchOptimizer _optimizer;

	/**
	 * @param namespaces The ownership registry to update for created/destroyed entities, layers and assets.
	 * @param optimizer The optimizer to run over each transaction's patches (null means just order by priority).
	 */
	public PatchApplicator(NamespaceManager namespaces, BatchOptimizer optimizer)
	{
		_namespaces = namespaces;
		_optimizer = optimizer;
	}

	/**
	 * Applies every patch of the transaction.  This never throws:  any failure (including an unexpected runtime
	 * exception) undoes the partial application and is described in the result.
	 *
	 * @param transaction The transaction (normally APPLYING, its state is not changed here).
	 * @param world The entity store.
	 * @param layers The layer store.
	 * @param assets The asset store.
	 * @return The outcome.
	 */
	public ApplyResult apply(Transaction transaction, IWorld world, LayerManager layers, AssetRegistry assets)
	{
		List<Patch> patches = _orderPatches(transaction.getPatches());
		_Context context = new _Context(world, layers, assets, transaction.getSource());
		int applied = 0;
		String error = null;
		for (Patch patch : patches)
		{
			try
			{
				_applyOne(context, patch);
				applied += 1;
			}
			catch (ApplyException e)
			{
				error = e.getMessage();
			}
			catch (RuntimeException e)
			{
				error = "Internal error applying " + patch + ": " + e;
			}
			if (null != error)
			{
				break;
			}
		}

		ApplyResult result;
		if (null == error)
		{
			for (Runnable ownership : context.onSuccess)
			{
				ownership.run();
			}
			result = new ApplyResult(transaction.getId(), true, applied, null);
		}
		else
		{
			for (int i = context.undo.size() - 1; i >= 0; --i)
			{
				context.undo.get(i).run();
			}
			result = new ApplyResult(transaction.getId(), false, applied, error);
		}
		return result;
	}


	private List<Patch> _orderPatches(List<Patch> patches)
	{
		List<Patch> ordered;
		if (null != _optimizer)
		{
			ordered = _optimizer.optimize(patches);
		}
		else
		{
			// List.sort is stable so equal priorities keep submission order.
			ordered = new ArrayList<>(patches);
			ordered.sort(Comparator.comparingInt((Patch patch) -> patch.priority()).reversed());
		}
		return ordered;
	}

	private void _applyOne(_Context context, Patch patch) throws ApplyException
	{
		switch (patch.getType())
		{
		case ENTITY:
			_applyEntity(context, (EntityPatch) patch.kind());
			break;
		case COMPONENT:
			_applyComponent(context, (ComponentPatch) patch.kind());
			break;
		case LAYER:
			_applyLayer(context, patch.source(), (LayerPatch) patch.kind());
			break;
		case ASSET:
			_applyAsset(context, patch.source(), (AssetPatch) patch.kind());
			break;
		case HIERARCHY:
			_applyHierarchy(context, (HierarchyPatch) patch.kind());
			break;
		case CAMERA:
			_applyCamera(context, (CameraPatch) patch.kind());
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _applyEntity(_Context context, EntityPatch patch) throws ApplyException
	{
		EntityRef ref = patch.entity();
		EntityRecord existing = context.world.get(ref);
		switch (patch.op())
		{
		case CREATE: {
			if (null != existing)
			{
				if (!patch.replaceExisting())
				{
					throw new ApplyException("Entity already exists: " + ref);
				}
				context.recordEntity(ref);
				context.world.destroy(ref);
			}
			else
			{
				context.recordEntity(ref);
			}
			boolean didInsert = context.world.insert(EntityRecord.create(ref, patch.archetype(), patch.components()));
			Assert.assertTrue(didInsert);
			context.onSuccess.add(() -> _namespaces.registerEntity(ref));
			break;
		}
		case DESTROY: {
			_requireEntity(existing, ref);
			// Children outlive their parent but are detached.  Only the kernel may detach another namespace's children.
			List<EntityRef> children = context.world.childrenOf(ref);
			for (EntityRef child : children)
			{
				if (!context.source.isKernel() && !context.source.equals(child.namespace()))
				{
					throw new ApplyException("Destroying " + ref + " would detach foreign child " + child);
				}
			}
			for (EntityRef child : children)
			{
				context.recordEntity(child);
				context.world.replace(context.world.get(child).withParent(null));
			}
			context.recordEntity(ref);
			context.world.destroy(ref);
			context.onSuccess.add(() -> _namespaces.unregisterEntity(ref));
			break;
		}
		case ENABLE:
		case DISABLE: {
			_requireEntity(existing, ref);
			context.recordEntity(ref);
			context.world.replace(existing.withEnabled(EntityPatch.Op.ENABLE == patch.op()));
			break;
		}
		default:
			throw Assert.unreachable();
		}
	}

	private void _applyComponent(_Context context, ComponentPatch patch) throws ApplyException
	{
		EntityRef ref = patch.entity();
		EntityRecord existing = context.world.get(ref);
		_requireEntity(existing, ref);
		switch (patch.op())
		{
		case SET:
			context.recordEntity(ref);
			context.world.replace(existing.withComponent(patch.component(), patch.data()));
			break;
		case UPDATE: {
			Value current = existing.getComponent(patch.component());
			if (null == current)
			{
				throw new ApplyException("Component " + patch.component() + " missing on " + ref);
			}
			if (Value.Type.OBJECT != current.getType())
			{
				throw new ApplyException("Component " + patch.component() + " on " + ref + " is not an object");
			}
			context.recordEntity(ref);
			context.world.replace(existing.withComponent(patch.component(), current.withFields(patch.fields())));
			break;
		}
		case REMOVE:
			// Removing an absent component is a no-op.
			if (null != existing.getComponent(patch.component()))
			{
				context.recordEntity(ref);
				context.world.replace(existing.withoutComponent(patch.component()));
			}
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _applyLayer(_Context context, NamespaceId source, LayerPatch patch) throws ApplyException
	{
		String layerId = patch.layerId();
		LayerState existing = context.layers.get(layerId);
		switch (patch.op())
		{
		case CREATE: {
			if (null != existing)
			{
				throw new ApplyException("Layer already exists: " + layerId);
			}
			if (null == patch.layerType())
			{
				throw new ApplyException("Layer " + layerId + " created without a type");
			}
			LayerState state = new LayerState(layerId
					, source
					, patch.layerType()
					, (null != patch.priority()) ? patch.priority() : 0
					, (null != patch.visible()) ? patch.visible() : true
					, (null != patch.blendMode()) ? patch.blendMode() : BlendMode.NORMAL
			);
			context.recordLayer(layerId);
			context.layers.put(state);
			context.onSuccess.add(() -> _namespaces.registerLayer(source, layerId));
			break;
		}
		case UPDATE: {
			if (null == existing)
			{
				throw new ApplyException("Layer not found: " + layerId);
			}
			LayerState state = new LayerState(layerId
					, existing.owner()
					, existing.layerType()
					, (null != patch.priority()) ? patch.priority() : existing.priority()
					, (null != patch.visible()) ? patch.visible() : existing.visible()
					, (null != patch.blendMode()) ? patch.blendMode() : existing.blendMode()
			);
			context.recordLayer(layerId);
			context.layers.put(state);
			break;
		}
		case DESTROY:
			if (null == existing)
			{
				throw new ApplyException("Layer not found: " + layerId);
			}
			context.recordLayer(layerId);
			context.layers.remove(layerId);
			context.onSuccess.add(() -> _namespaces.unregisterLayer(layerId));
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _applyAsset(_Context context, NamespaceId source, AssetPatch patch) throws ApplyException
	{
		String assetId = patch.assetId();
		AssetState existing = context.assets.get(assetId);
		switch (patch.op())
		{
		case LOAD: {
			if (null != existing)
			{
				throw new ApplyException("Asset already loaded: " + assetId);
			}
			if (null == patch.path())
			{
				throw new ApplyException("Asset " + assetId + " loaded without a path");
			}
			context.recordAsset(assetId);
			context.assets.put(new AssetState(assetId, source, patch.path(), patch.assetType(), patch.data(), 0L));
			context.onSuccess.add(() -> _namespaces.registerAsset(source, assetId));
			break;
		}
		case UNLOAD:
			if (null == existing)
			{
				throw new ApplyException("Asset not loaded: " + assetId);
			}
			context.recordAsset(assetId);
			context.assets.remove(assetId);
			context.onSuccess.add(() -> _namespaces.unregisterAsset(assetId));
			break;
		case UPDATE:
			if (null == existing)
			{
				throw new ApplyException("Asset not loaded: " + assetId);
			}
			context.recordAsset(assetId);
			context.assets.put(existing.withData(patch.data()));
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _applyHierarchy(_Context context, HierarchyPatch patch) throws ApplyException
	{
		EntityRef ref = patch.entity();
		EntityRecord existing = context.world.get(ref);
		_requireEntity(existing, ref);
		switch (patch.op())
		{
		case SET_PARENT: {
			EntityRef parent = patch.other();
			if (null == parent)
			{
				// A null parent is just a detach.
				context.recordEntity(ref);
				context.world.replace(existing.withParent(null));
			}
			else
			{
				_requireEntity(context.world.get(parent), parent);
				_checkNoCycle(context.world, ref, parent);
				context.recordEntity(ref);
				context.world.replace(existing.withParent(parent));
			}
			break;
		}
		case REMOVE_PARENT:
			context.recordEntity(ref);
			context.world.replace(existing.withParent(null));
			break;
		case DESPAWN_RECURSIVE: {
			List<EntityRef> doomed = new ArrayList<>();
			_collectDeepestFirst(context.world, ref, doomed);
			for (EntityRef target : doomed)
			{
				if (!context.source.isKernel() && !context.source.equals(target.namespace()))
				{
					throw new ApplyException("Despawn of " + ref + " would destroy foreign entity " + target);
				}
			}
			// The root may itself have a parent but that reference disappears with it.
			for (EntityRef target : doomed)
			{
				context.recordEntity(target);
				context.world.destroy(target);
				context.onSuccess.add(() -> _namespaces.unregisterEntity(target));
			}
			break;
		}
		case REPARENT_CHILDREN: {
			EntityRef newParent = patch.other();
			if (null != newParent)
			{
				_requireEntity(context.world.get(newParent), newParent);
			}
			_moveChildren(context, ref, newParent);
			break;
		}
		case DETACH_CHILDREN:
			_moveChildren(context, ref, null);
			break;
		case SET_VISIBLE:
			context.recordEntity(ref);
			context.world.replace(existing.withComponent(HierarchyPatch.VISIBLE_COMPONENT, Value.ofBool(patch.visible())));
			break;
		default:
			throw Assert.unreachable();
		}
	}

	private void _applyCamera(_Context context, CameraPatch patch) throws ApplyException
	{
		EntityRef ref = patch.entity();
		EntityRecord existing = context.world.get(ref);
		_requireEntity(existing, ref);
		Value camera = existing.getComponent(CameraPatch.CAMERA_COMPONENT);
		Map<String, Value> fields = new TreeMap<>();
		if (null != camera)
		{
			if (Value.Type.OBJECT != camera.getType())
			{
				throw new ApplyException("Camera component on " + ref + " is not an object");
			}
			fields.putAll(camera.asObject());
		}

		Value argument = patch.argument();
		switch (patch.op())
		{
		case SET_MAIN:
			fields.put(CameraPatch.FIELD_MAIN, Value.TRUE);
			break;
		case CLEAR_MAIN:
			fields.put(CameraPatch.FIELD_MAIN, Value.FALSE);
			break;
		case SET_ACTIVE:
			fields.put(CameraPatch.FIELD_ACTIVE, Value.ofBool(argument.asBool()));
			break;
		case SET_PERSPECTIVE:
			fields.put(CameraPatch.FIELD_PROJECTION, Value.ofString(CameraPatch.PROJECTION_PERSPECTIVE));
			fields.put(CameraPatch.FIELD_FOV, Value.ofFloat(argument.asFloat()));
			break;
		case SET_ORTHOGRAPHIC:
			fields.put(CameraPatch.FIELD_PROJECTION, Value.ofString(CameraPatch.PROJECTION_ORTHOGRAPHIC));
			fields.put(CameraPatch.FIELD_HEIGHT, Value.ofFloat(argument.asFloat()));
			break;
		case SET_CLIP_PLANES: {
			List<Value> planes = argument.asArray();
			if (2 != planes.size())
			{
				throw new ApplyException("Clip planes need [near, far] for " + ref);
			}
			double near = planes.get(0).asFloat();
			double far = planes.get(1).asFloat();
			if ((near <= 0.0) || (far <= near))
			{
				throw new ApplyException("Invalid clip planes " + near + ".." + far + " for " + ref);
			}
			fields.put(CameraPatch.FIELD_NEAR, Value.ofFloat(near));
			fields.put(CameraPatch.FIELD_FAR, Value.ofFloat(far));
			break;
		}
		case SET_PRIORITY:
			fields.put(CameraPatch.FIELD_PRIORITY, Value.ofInt(argument.asInt()));
			break;
		default:
			throw Assert.unreachable();
		}
		context.recordEntity(ref);
		context.world.replace(existing.withComponent(CameraPatch.CAMERA_COMPONENT, Value.ofObject(fields)));
	}

	private void _moveChildren(_Context context, EntityRef parent, EntityRef newParent) throws ApplyException
	{
		List<EntityRef> children = context.world.childrenOf(parent);
		for (EntityRef child : children)
		{
			if (!context.source.isKernel() && !context.source.equals(child.namespace()))
			{
				throw new ApplyException("Cannot move foreign child " + child + " of " + parent);
			}
			if (null != newParent)
			{
				_checkNoCycle(context.world, child, newParent);
			}
			context.recordEntity(child);
			context.world.replace(context.world.get(child).withParent(newParent));
		}
	}

	private static void _requireEntity(EntityRecord record, EntityRef ref) throws ApplyException
	{
		if (null == record)
		{
			throw new ApplyException("Entity not found: " + ref);
		}
	}

	// Fails if making "parent" the parent of "child" would create a loop.
	private static void _checkNoCycle(IWorld world, EntityRef child, EntityRef parent) throws ApplyException
	{
		EntityRef cursor = parent;
		while (null != cursor)
		{
			if (cursor.equals(child))
			{
				throw new ApplyException("Parenting " + child + " to " + parent + " would create a cycle");
			}
			EntityRecord record = world.get(cursor);
			cursor = (null != record) ? record.parent() : null;
		}
	}

	private static void _collectDeepestFirst(IWorld world, EntityRef root, List<EntityRef> out)
	{
		for (EntityRef child : world.childrenOf(root))
		{
			_collectDeepestFirst(world, child, out);
		}
		out.add(root);
	}


	/**
	 * Thrown when a patch can't be applied to the current state.  Never escapes the applicator.
	 */
	public static class ApplyException extends Exception
	{
		private static final long serialVersionUID = 1L;
		public ApplyException(String message)
		{
			super(message);
		}
	}

	private static class _Context
	{
		public final IWorld world;
		public final LayerManager layers;
		public final AssetRegistry assets;
		public final NamespaceId source;
		public final List<Runnable> undo = new ArrayList<>();
		public final List<Runnable> onSuccess = new ArrayList<>();
		public _Context(IWorld world, LayerManager layers, AssetRegistry assets, NamespaceId source)
		{
			this.world = world;
			this.layers = layers;
			this.assets = assets;
			this.source = source;
		}
		public void recordEntity(EntityRef ref)
		{
			EntityRecord prior = this.world.get(ref);
			this.undo.add(() -> {
				if (null == prior)
				{
					this.world.destroy(ref);
				}
				else if (this.world.contains(ref))
				{
					this.world.replace(prior);
				}
				else
				{
					this.world.insert(prior);
				}
			});
		}
		public void recordLayer(String layerId)
		{
			LayerState prior = this.layers.get(layerId);
			this.undo.add(() -> {
				if (null == prior)
				{
					this.layers.remove(layerId);
				}
				else
				{
					this.layers.put(prior);
				}
			});
		}
		public void recordAsset(String assetId)
		{
			AssetState prior = this.assets.get(assetId);
			this.undo.add(() -> {
				if (null == prior)
				{
					this.assets.remove(assetId);
				}
				else
				{
					this.assets.put(prior);
				}
			});
		}
	}
}
