package com.jeffdisher.tessera.kernel;

import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.jeffdisher.tessera.logic.BatchOptimizer;
import com.jeffdisher.tessera.logic.MonotonicIdAssigner;
import com.jeffdisher.tessera.namespaces.CapabilityChecker;
import com.jeffdisher.tessera.namespaces.NamespaceManager;
import com.jeffdisher.tessera.namespaces.ResourceLimits;
import com.jeffdisher.tessera.patches.AssetPatch;
import com.jeffdisher.tessera.patches.BlendMode;
import com.jeffdisher.tessera.patches.CameraPatch;
import com.jeffdisher.tessera.patches.ComponentPatch;
import com.jeffdisher.tessera.patches.EntityPatch;
import com.jeffdisher.tessera.patches.HierarchyPatch;
import com.jeffdisher.tessera.patches.IPatchKind;
import com.jeffdisher.tessera.patches.LayerPatch;
import com.jeffdisher.tessera.patches.LayerType;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.snapshots.StateSnapshot;
import com.jeffdisher.tessera.transactions.Transaction;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.SnapshotId;
import com.jeffdisher.tessera.types.TransactionId;
import com.jeffdisher.tessera.types.Value;
import com.jeffdisher.tessera.world.ArenaWorld;
import com.jeffdisher.tessera.world.AssetRegistry;
import com.jeffdisher.tessera.world.EntityRecord;
import com.jeffdisher.tessera.world.LayerManager;


public class TestPatchApplicator
{
	private NamespaceManager _namespaces;
	private NamespaceId _app;
	private NamespaceId _other;
	private ArenaWorld _world;
	private LayerManager _layers;
	private AssetRegistry _assets;
	private long _nextId;

	@Before
	public void setup()
	{
		CapabilityChecker capabilities = new CapabilityChecker(new MonotonicIdAssigner(1L), () -> 1000L);
		_namespaces = new NamespaceManager(capabilities, new MonotonicIdAssigner(1L));
		_app = _namespaces.createNamespace("app", ResourceLimits.DEFAULT_APP);
		_other = _namespaces.createNamespace("other", ResourceLimits.DEFAULT_APP);
		_world = new ArenaWorld();
		_layers = new LayerManager();
		_assets = new AssetRegistry();
		_nextId = 1L;
	}

	@Test
	public void createAndWrite() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef ref = EntityRef.of(_app, 1L);
		ApplyResult result = applicator.apply(_transaction(_app
				, EntityPatch.create(ref, "Player", Map.of("Health", Value.ofInt(10L)))
				, ComponentPatch.set(ref, "Name", Value.ofString("hero"))
		), _world, _layers, _assets);
		Assert.assertTrue(result.success());
		Assert.assertEquals(2, result.patchesApplied());
		Assert.assertNull(result.error());
		EntityRecord record = _world.get(ref);
		Assert.assertEquals("Player", record.archetype());
		Assert.assertEquals(10L, record.getComponent("Health").asInt());
		Assert.assertEquals("hero", record.getComponent("Name").asString());
		Assert.assertTrue(_namespaces.ownsEntity(ref));
	}

	@Test
	public void failureUndoesEverything() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef existing = EntityRef.of(_app, 1L);
		EntityRef created = EntityRef.of(_app, 2L);
		_world.insert(EntityRecord.create(existing, null, Map.of("Health", Value.ofInt(10L))));
		
		ApplyResult result = applicator.apply(_transaction(_app
				, ComponentPatch.set(existing, "Health", Value.ofInt(5L))
				, EntityPatch.create(created)
				, LayerPatch.create("hud", LayerType.OVERLAY, 1)
				, AssetPatch.load("tex", "textures/a.png", "texture")
				, EntityPatch.destroy(EntityRef.of(_app, 99L))
		), _world, _layers, _assets);
		Assert.assertFalse(result.success());
		Assert.assertEquals(4, result.patchesApplied());
		Assert.assertTrue(result.error().contains("Entity not found"));
		
		Assert.assertEquals(10L, _world.get(existing).getComponent("Health").asInt());
		Assert.assertNull(_world.get(created));
		Assert.assertEquals(1, _world.entityCount());
		Assert.assertEquals(0, _layers.count());
		Assert.assertEquals(0, _assets.count());
		// Ownership is only published on success.
		Assert.assertFalse(_namespaces.ownsEntity(created));
		Assert.assertNull(_namespaces.getLayerOwner("hud"));
		Assert.assertNull(_namespaces.getAssetOwner("tex"));
		Assert.assertFalse(result.toTransactionResult().success());
	}

	@Test
	public void destroyUndoRestoresChildren() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef parent = EntityRef.of(_app, 1L);
		EntityRef child = EntityRef.of(_app, 2L);
		_world.insert(EntityRecord.create(parent, null, Map.of()));
		_world.insert(EntityRecord.create(child, null, Map.of()).withParent(parent));
		
		ApplyResult result = applicator.apply(_transaction(_app
				, EntityPatch.destroy(parent)
				, EntityPatch.enable(EntityRef.of(_app, 50L))
		), _world, _layers, _assets);
		Assert.assertFalse(result.success());
		Assert.assertNotNull(_world.get(parent));
		Assert.assertEquals(parent, _world.get(child).parent());
		
		// Now for real:  the child survives, detached.
		Assert.assertTrue(applicator.apply(_transaction(_app, EntityPatch.destroy(parent)), _world, _layers, _assets).success());
		Assert.assertNull(_world.get(parent));
		Assert.assertNull(_world.get(child).parent());
	}

	@Test
	public void destroyWithForeignChild() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef parent = EntityRef.of(_app, 1L);
		EntityRef foreign = EntityRef.of(_other, 1L);
		_world.insert(EntityRecord.create(parent, null, Map.of()));
		_world.insert(EntityRecord.create(foreign, null, Map.of()).withParent(parent));
		
		ApplyResult result = applicator.apply(_transaction(_app, EntityPatch.destroy(parent)), _world, _layers, _assets);
		Assert.assertFalse(result.success());
		Assert.assertTrue(result.error().contains("foreign"));
		Assert.assertNotNull(_world.get(parent));
		Assert.assertEquals(parent, _world.get(foreign).parent());
		// The kernel may.
		Assert.assertTrue(applicator.apply(_transaction(NamespaceId.KERNEL, EntityPatch.destroy(parent)), _world, _layers, _assets).success());
		Assert.assertNull(_world.get(parent));
		Assert.assertNull(_world.get(foreign).parent());
	}

	@Test
	public void createExisting() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef ref = EntityRef.of(_app, 1L);
		_world.insert(EntityRecord.create(ref, "Old", Map.of("Health", Value.ofInt(1L))));
		Assert.assertFalse(applicator.apply(_transaction(_app, EntityPatch.create(ref, "New", Map.of())), _world, _layers, _assets).success());
		Assert.assertEquals("Old", _world.get(ref).archetype());
		
		Assert.assertTrue(applicator.apply(_transaction(_app, EntityPatch.create(ref, "New", Map.of()).asReplacement()), _world, _layers, _assets).success());
		Assert.assertEquals("New", _world.get(ref).archetype());
		Assert.assertNull(_world.get(ref).getComponent("Health"));
	}

	@Test
	public void componentUpdate() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef ref = EntityRef.of(_app, 1L);
		_world.insert(EntityRecord.create(ref, null, Map.of("Transform", Value.ofObject(Map.of("x", Value.ofFloat(1.0), "y", Value.ofFloat(2.0))), "Count", Value.ofInt(1L))));
		
		Assert.assertTrue(applicator.apply(_transaction(_app, ComponentPatch.update(ref, "Transform", Map.of("y", Value.ofFloat(7.0)))), _world, _layers, _assets).success());
		Map<String, Value> transform = _world.get(ref).getComponent("Transform").asObject();
		Assert.assertEquals(1.0, transform.get("x").asFloat(), 0.0);
		Assert.assertEquals(7.0, transform.get("y").asFloat(), 0.0);
		
		// Not an object.
		Assert.assertFalse(applicator.apply(_transaction(_app, ComponentPatch.update(ref, "Count", Map.of("y", Value.ofInt(1L)))), _world, _layers, _assets).success());
		// Missing.
		Assert.assertFalse(applicator.apply(_transaction(_app, ComponentPatch.update(ref, "Missing", Map.of("y", Value.ofInt(1L)))), _world, _layers, _assets).success());
		// Removing something absent is fine.
		Assert.assertTrue(applicator.apply(_transaction(_app, ComponentPatch.remove(ref, "Missing")), _world, _layers, _assets).success());
	}

	@Test
	public void hierarchyCycle() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef a = EntityRef.of(_app, 1L);
		EntityRef b = EntityRef.of(_app, 2L);
		EntityRef c = EntityRef.of(_app, 3L);
		_world.insert(EntityRecord.create(a, null, Map.of()));
		_world.insert(EntityRecord.create(b, null, Map.of()));
		_world.insert(EntityRecord.create(c, null, Map.of()));
		Assert.assertTrue(applicator.apply(_transaction(_app, HierarchyPatch.setParent(b, a), HierarchyPatch.setParent(c, b)), _world, _layers, _assets).success());
		
		ApplyResult result = applicator.apply(_transaction(_app, HierarchyPatch.setParent(a, c)), _world, _layers, _assets);
		Assert.assertFalse(result.success());
		Assert.assertTrue(result.error().contains("cycle"));
		Assert.assertNull(_world.get(a).parent());
		// Self-parenting is the shortest cycle.
		Assert.assertFalse(applicator.apply(_transaction(_app, HierarchyPatch.setParent(a, a)), _world, _layers, _assets).success());
	}

	@Test
	public void despawnRecursive() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef root = EntityRef.of(_app, 1L);
		EntityRef child = EntityRef.of(_app, 2L);
		EntityRef grandchild = EntityRef.of(_app, 3L);
		EntityRef bystander = EntityRef.of(_app, 4L);
		Assert.assertTrue(applicator.apply(_transaction(_app
				, EntityPatch.create(root)
				, EntityPatch.create(child)
				, EntityPatch.create(grandchild)
				, EntityPatch.create(bystander)
				, HierarchyPatch.setParent(child, root)
				, HierarchyPatch.setParent(grandchild, child)
		), _world, _layers, _assets).success());
		Assert.assertEquals(4, _namespaces.entityCount(_app));
		
		Assert.assertTrue(applicator.apply(_transaction(_app, HierarchyPatch.despawnRecursive(root)), _world, _layers, _assets).success());
		Assert.assertEquals(1, _world.entityCount());
		Assert.assertNotNull(_world.get(bystander));
		Assert.assertEquals(1, _namespaces.entityCount(_app));
	}

	@Test
	public void despawnForeignDescendant() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef root = EntityRef.of(_app, 1L);
		EntityRef foreign = EntityRef.of(_other, 1L);
		_world.insert(EntityRecord.create(root, null, Map.of()));
		_world.insert(EntityRecord.create(foreign, null, Map.of()).withParent(root));
		
		Assert.assertFalse(applicator.apply(_transaction(_app, HierarchyPatch.despawnRecursive(root)), _world, _layers, _assets).success());
		Assert.assertEquals(2, _world.entityCount());
		// The kernel may.
		Assert.assertTrue(applicator.apply(_transaction(NamespaceId.KERNEL, HierarchyPatch.despawnRecursive(root)), _world, _layers, _assets).success());
		Assert.assertEquals(0, _world.entityCount());
	}

	@Test
	public void reparentAndDetach() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef oldParent = EntityRef.of(_app, 1L);
		EntityRef newParent = EntityRef.of(_app, 2L);
		EntityRef first = EntityRef.of(_app, 3L);
		EntityRef second = EntityRef.of(_app, 4L);
		_world.insert(EntityRecord.create(oldParent, null, Map.of()));
		_world.insert(EntityRecord.create(newParent, null, Map.of()));
		_world.insert(EntityRecord.create(first, null, Map.of()).withParent(oldParent));
		_world.insert(EntityRecord.create(second, null, Map.of()).withParent(oldParent));
		
		Assert.assertTrue(applicator.apply(_transaction(_app, HierarchyPatch.reparentChildren(oldParent, newParent)), _world, _layers, _assets).success());
		Assert.assertEquals(2, _world.childrenOf(newParent).size());
		Assert.assertTrue(_world.childrenOf(oldParent).isEmpty());
		
		Assert.assertTrue(applicator.apply(_transaction(_app, HierarchyPatch.detachChildren(newParent)), _world, _layers, _assets).success());
		Assert.assertNull(_world.get(first).parent());
		Assert.assertNull(_world.get(second).parent());
		
		Assert.assertTrue(applicator.apply(_transaction(_app, HierarchyPatch.setVisible(first, false)), _world, _layers, _assets).success());
		Assert.assertFalse(_world.get(first).getComponent(HierarchyPatch.VISIBLE_COMPONENT).asBool());
	}

	@Test
	public void camera() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef ref = EntityRef.of(_app, 1L);
		_world.insert(EntityRecord.create(ref, null, Map.of()));
		Assert.assertTrue(applicator.apply(_transaction(_app
				, CameraPatch.setMain(ref)
				, CameraPatch.setPerspective(ref, 60.0)
				, CameraPatch.setClipPlanes(ref, 0.1, 100.0)
				, CameraPatch.setPriority(ref, 3)
		), _world, _layers, _assets).success());
		Map<String, Value> camera = _world.get(ref).getComponent(CameraPatch.CAMERA_COMPONENT).asObject();
		Assert.assertTrue(camera.get(CameraPatch.FIELD_MAIN).asBool());
		Assert.assertEquals(CameraPatch.PROJECTION_PERSPECTIVE, camera.get(CameraPatch.FIELD_PROJECTION).asString());
		Assert.assertEquals(60.0, camera.get(CameraPatch.FIELD_FOV).asFloat(), 0.0);
		Assert.assertEquals(100.0, camera.get(CameraPatch.FIELD_FAR).asFloat(), 0.0);
		Assert.assertEquals(3L, camera.get(CameraPatch.FIELD_PRIORITY).asInt());
		
		// Far must be beyond near.
		ApplyResult result = applicator.apply(_transaction(_app
				, CameraPatch.clearMain(ref)
				, CameraPatch.setClipPlanes(ref, 10.0, 5.0)
		), _world, _layers, _assets);
		Assert.assertFalse(result.success());
		Assert.assertTrue(_world.get(ref).getComponent(CameraPatch.CAMERA_COMPONENT).asObject().get(CameraPatch.FIELD_MAIN).asBool());
	}

	@Test
	public void layersAndAssets() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		Assert.assertTrue(applicator.apply(_transaction(_app
				, LayerPatch.create("hud", LayerType.OVERLAY, 4)
				, AssetPatch.load("tex", "textures/a.png", "texture")
		), _world, _layers, _assets).success());
		Assert.assertEquals(_app, _layers.get("hud").owner());
		Assert.assertTrue(_layers.get("hud").visible());
		Assert.assertEquals(_app, _namespaces.getLayerOwner("hud"));
		Assert.assertEquals(0L, _assets.get("tex").version());
		
		Assert.assertTrue(applicator.apply(_transaction(_app
				, LayerPatch.update("hud", null, false, null)
				, AssetPatch.update("tex", Value.ofString("pixels"))
		), _world, _layers, _assets).success());
		Assert.assertFalse(_layers.get("hud").visible());
		Assert.assertEquals(4, _layers.get("hud").priority());
		Assert.assertEquals(1L, _assets.get("tex").version());
		
		// Creating a layer twice fails.
		Assert.assertFalse(applicator.apply(_transaction(_app, LayerPatch.create("hud", LayerType.CONTENT, 0)), _world, _layers, _assets).success());
		
		Assert.assertTrue(applicator.apply(_transaction(_app
				, LayerPatch.destroy("hud")
				, AssetPatch.unload("tex")
		), _world, _layers, _assets).success());
		Assert.assertEquals(0, _layers.count());
		Assert.assertEquals(0, _assets.count());
		Assert.assertNull(_namespaces.getAssetOwner("tex"));
	}

	@Test
	public void optimizedApplication() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, new BatchOptimizer());
		EntityRef ref = EntityRef.of(_app, 1L);
		_world.insert(EntityRecord.create(ref, null, Map.of()));
		ApplyResult result = applicator.apply(_transaction(_app
				, ComponentPatch.set(ref, "Health", Value.ofInt(1L))
				, ComponentPatch.set(ref, "Health", Value.ofInt(2L))
				, ComponentPatch.set(ref, "Health", Value.ofInt(3L))
		), _world, _layers, _assets);
		Assert.assertTrue(result.success());
		// The three writes merge into one.
		Assert.assertEquals(1, result.patchesApplied());
		Assert.assertEquals(3L, _world.get(ref).getComponent("Health").asInt());
	}

	@Test
	public void optimizerKeepsLifecycleOrder() throws Throwable
	{
		// The write lands on the old entity, which is then destroyed, so the re-created one never has it.
		EntityRef ref = EntityRef.of(_app, 1L);
		Transaction transaction = _transaction(_app
				, ComponentPatch.set(ref, "Score", Value.ofInt(7L))
				, EntityPatch.destroy(ref)
				, EntityPatch.create(ref)
		);
		StateSnapshot plain = _applyToFreshWorld(new PatchApplicator(_namespaces, null), transaction, 3);
		StateSnapshot optimized = _applyToFreshWorld(new PatchApplicator(_namespaces, new BatchOptimizer()), transaction, 3);
		Assert.assertNull(plain.getComponents().get(ref).get("Score"));
		Assert.assertTrue(plain.sameStateAs(optimized));
	}

	@Test
	public void optimizedMatchesUnoptimized() throws Throwable
	{
		EntityRef a = EntityRef.of(_app, 1L);
		EntityRef b = EntityRef.of(_app, 2L);
		EntityRef c = EntityRef.of(_app, 3L);
		EntityRef fresh = EntityRef.of(_app, 10L);
		EntityRef temp = EntityRef.of(_app, 11L);
		Transaction transaction = _transaction(_app
				, EntityPatch.create(fresh, "Npc", Map.of("Health", Value.ofObject(Map.of("hp", Value.ofInt(5L)))))
				, ComponentPatch.update(fresh, "Health", Map.of("hp", Value.ofInt(6L)))
				, ComponentPatch.set(a, "Tag", Value.ofString("x"))
				, HierarchyPatch.setParent(fresh, a)
				, ComponentPatch.set(a, "Tag", Value.ofString("y"))
				, ComponentPatch.update(a, "Health", Map.of("max", Value.ofInt(10L)))
				, ComponentPatch.update(a, "Health", Map.of("hp", Value.ofInt(1L)))
				, ComponentPatch.set(c, CameraPatch.CAMERA_COMPONENT, Value.ofObject(Map.of(CameraPatch.FIELD_FOV, Value.ofFloat(30.0))))
				, CameraPatch.setMain(c)
				, ComponentPatch.set(c, CameraPatch.CAMERA_COMPONENT, Value.ofObject(Map.of(CameraPatch.FIELD_FOV, Value.ofFloat(45.0))))
				, EntityPatch.disable(b)
				, EntityPatch.enable(b)
				, ComponentPatch.set(b, "Mark", Value.ofInt(1L))
				, EntityPatch.destroy(b)
				, EntityPatch.create(b, "Again", Map.of())
				, HierarchyPatch.setParent(b, fresh)
				, EntityPatch.create(temp)
				, ComponentPatch.set(temp, "X", Value.ofInt(1L))
				, EntityPatch.destroy(temp)
				, HierarchyPatch.setVisible(a, false)
		);
		StateSnapshot plain = _applyToFreshWorld(new PatchApplicator(_namespaces, null), transaction, 20);
		// Two pairs fold and the temporary entity disappears.
		StateSnapshot optimized = _applyToFreshWorld(new PatchApplicator(_namespaces, new BatchOptimizer()), transaction, 15);
		Assert.assertTrue(plain.sameStateAs(optimized));
		
		Assert.assertNull(plain.getComponents().get(b).get("Mark"));
		Assert.assertEquals(fresh, plain.getEntities().get(b).parent());
		Assert.assertFalse(plain.getComponents().get(c).get(CameraPatch.CAMERA_COMPONENT).asObject().containsKey(CameraPatch.FIELD_MAIN));
		Assert.assertEquals(Value.ofObject(Map.of("hp", Value.ofInt(1L), "max", Value.ofInt(10L))), plain.getComponents().get(a).get("Health"));
		Assert.assertFalse(plain.getEntities().containsKey(temp));
	}

	@Test
	public void diffRoundTrip() throws Throwable
	{
		EntityRef a = EntityRef.of(_app, 1L);
		EntityRef b = EntityRef.of(_app, 2L);
		EntityRef c = EntityRef.of(_app, 3L);
		EntityRef doomed = EntityRef.of(_app, 4L);
		EntityRef renamed = EntityRef.of(_app, 5L);
		EntityRef added = EntityRef.of(_app, 6L);
		PatchApplicator applicator = new PatchApplicator(_namespaces, new BatchOptimizer());
		Assert.assertTrue(applicator.apply(_transaction(_app
				, EntityPatch.create(a, "Node", Map.of("Health", Value.ofObject(Map.of("hp", Value.ofInt(10L))), "Tag", Value.ofString("t")))
				, EntityPatch.create(b, "Node", Map.of())
				, EntityPatch.create(c, "Prop", Map.of("Name", Value.ofString("c")))
				, EntityPatch.create(doomed, "Gone", Map.of())
				, EntityPatch.create(renamed, "Old", Map.of("Keep", Value.ofInt(1L)))
				, HierarchyPatch.setParent(b, a)
				, EntityPatch.disable(c)
				, LayerPatch.create("hud", LayerType.OVERLAY, 1)
				, LayerPatch.create("bg", LayerType.CONTENT, 0)
				, AssetPatch.load("tex", "textures/a.png", "texture")
				, AssetPatch.load("mesh", "meshes/a.obj", "mesh")
				, AssetPatch.update("mesh", Value.ofString("v1"))
				, AssetPatch.load("snd", "sounds/a.ogg", "sound")
		), _world, _layers, _assets).success());
		StateSnapshot before = _capture(1L);
		
		Assert.assertTrue(applicator.apply(_transaction(_app
				// The parent swap:  b under a becomes a under b.
				, HierarchyPatch.removeParent(b)
				, HierarchyPatch.setParent(a, b)
				, ComponentPatch.update(a, "Health", Map.of("hp", Value.ofInt(3L)))
				, ComponentPatch.remove(a, "Tag")
				, ComponentPatch.set(a, "New", Value.ofInt(1L))
				, EntityPatch.enable(c)
				, EntityPatch.destroy(doomed)
				, EntityPatch.create(renamed, "New", Map.of("Other", Value.ofInt(2L))).asReplacement()
				, EntityPatch.create(added, "Fresh", Map.of("X", Value.ofInt(1L)))
				, LayerPatch.update("hud", 7, false, BlendMode.ADDITIVE)
				, LayerPatch.destroy("bg")
				, LayerPatch.create("fx", LayerType.EFFECT, 2)
				, AssetPatch.update("tex", Value.ofInt(5L))
				, AssetPatch.update("mesh", null)
				, AssetPatch.unload("snd")
				, AssetPatch.load("music", "sounds/b.ogg", "sound")
		), _world, _layers, _assets).success());
		StateSnapshot after = _capture(2L);
		Assert.assertFalse(before.sameStateAs(after));
		
		// Back to the first state, with kernel authority as a rollback would do it.
		ApplyResult back = applicator.apply(_kernelTransaction(before.diff(after)), _world, _layers, _assets);
		Assert.assertTrue(back.error(), back.success());
		StateSnapshot restored = _capture(3L);
		Assert.assertTrue(before.sameStateAs(restored));
		Assert.assertNull(_assets.get("tex").data());
		Assert.assertEquals(a, _world.get(b).parent());
		Assert.assertNull(_world.get(a).parent());
		
		// And forward again.
		ApplyResult forward = applicator.apply(_kernelTransaction(after.diff(restored)), _world, _layers, _assets);
		Assert.assertTrue(forward.error(), forward.success());
		Assert.assertTrue(after.sameStateAs(_capture(4L)));
		
		// Nothing to do between equal states.
		Assert.assertTrue(after.diff(_capture(5L)).isEmpty());
	}

	@Test
	public void priorityOrdering() throws Throwable
	{
		PatchApplicator applicator = new PatchApplicator(_namespaces, null);
		EntityRef ref = EntityRef.of(_app, 1L);
		Transaction transaction = new Transaction(new TransactionId(_nextId++), _app, 0L);
		// The create has the higher priority so it runs first even though it was added last.
		transaction.addPatch(Patch.of(_app, ComponentPatch.set(ref, "Health", Value.ofInt(1L)), 0));
		transaction.addPatch(Patch.of(_app, EntityPatch.create(ref), 10));
		transaction.submit();
		Assert.assertTrue(applicator.apply(transaction, _world, _layers, _assets).success());
		Assert.assertEquals(1L, _world.get(ref).getComponent("Health").asInt());
	}


	private Transaction _transaction(NamespaceId source, IPatchKind... kinds)
	{
		Transaction transaction = new Transaction(new TransactionId(_nextId++), source, 0L);
		for (IPatchKind kind : kinds)
		{
			transaction.addPatch(Patch.of(source, kind));
		}
		transaction.submit();
		return transaction;
	}

	private Transaction _kernelTransaction(List<Patch> patches)
	{
		Transaction transaction = new Transaction(new TransactionId(_nextId++), NamespaceId.KERNEL, 0L);
		for (Patch patch : patches)
		{
			transaction.addPatch(patch);
		}
		transaction.submit();
		return transaction;
	}

	private StateSnapshot _capture(long id)
	{
		return StateSnapshot.capture(new SnapshotId(id), 0L, _world, _layers, _assets);
	}

	// Applies the transaction to a new world holding three entities (1 is the parent of 2) and captures the result.
	private StateSnapshot _applyToFreshWorld(PatchApplicator applicator, Transaction transaction, int expectedApplied)
	{
		ArenaWorld world = new ArenaWorld();
		LayerManager layers = new LayerManager();
		AssetRegistry assets = new AssetRegistry();
		EntityRef first = EntityRef.of(_app, 1L);
		world.insert(EntityRecord.create(first, "Node", Map.of("Health", Value.ofObject(Map.of("hp", Value.ofInt(10L))))));
		world.insert(EntityRecord.create(EntityRef.of(_app, 2L), "Node", Map.of()).withParent(first));
		world.insert(EntityRecord.create(EntityRef.of(_app, 3L), "Prop", Map.of()));
		ApplyResult result = applicator.apply(transaction, world, layers, assets);
		Assert.assertTrue(result.error(), result.success());
		Assert.assertEquals(expectedApplied, result.patchesApplied());
		return StateSnapshot.capture(new SnapshotId(1L), 0L, world, layers, assets);
	}
}
