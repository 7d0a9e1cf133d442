package com.jeffdisher.tessera.world;

import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.Value;


public class TestArenaWorld
{
	private static final NamespaceId APP = new NamespaceId(1L);

	@Test
	public void insertAndGet() throws Throwable
	{
		ArenaWorld world = new ArenaWorld();
		EntityRef ref = EntityRef.of(APP, 1L);
		Assert.assertNull(world.get(ref));
		Assert.assertTrue(world.insert(EntityRecord.create(ref, "Player", Map.of("Health", Value.ofInt(10L)))));
		// Duplicates are refused.
		Assert.assertFalse(world.insert(EntityRecord.create(ref, "Other", Map.of())));
		
		EntityRecord record = world.get(ref);
		Assert.assertEquals("Player", record.archetype());
		Assert.assertTrue(record.enabled());
		Assert.assertEquals(10L, record.getComponent("Health").asInt());
		Assert.assertEquals(1, world.entityCount());
	}

	@Test
	public void replace() throws Throwable
	{
		ArenaWorld world = new ArenaWorld();
		EntityRef ref = EntityRef.of(APP, 1L);
		EntityRecord original = EntityRecord.create(ref, null, Map.of());
		Assert.assertFalse(world.replace(original));
		world.insert(original);
		Assert.assertTrue(world.replace(original.withEnabled(false).withComponent("Name", Value.ofString("a"))));
		EntityRecord updated = world.get(ref);
		Assert.assertFalse(updated.enabled());
		Assert.assertEquals("a", updated.getComponent("Name").asString());
		// The old record is untouched.
		Assert.assertTrue(original.components().isEmpty());
	}

	@Test
	public void staleHandles() throws Throwable
	{
		ArenaWorld world = new ArenaWorld();
		EntityRef first = EntityRef.of(APP, 1L);
		EntityRef second = EntityRef.of(APP, 2L);
		world.insert(EntityRecord.create(first, null, Map.of()));
		ArenaWorld.EntityHandle handle = world.handleOf(first);
		Assert.assertNotNull(world.resolve(handle));
		
		Assert.assertNotNull(world.destroy(first));
		Assert.assertNull(world.destroy(first));
		Assert.assertNull(world.handleOf(first));
		
		// The slot is reused but the old handle must not see the new entity.
		world.insert(EntityRecord.create(second, null, Map.of()));
		Assert.assertEquals(1, world.capacity());
		ArenaWorld.EntityHandle newHandle = world.handleOf(second);
		Assert.assertEquals(handle.index(), newHandle.index());
		Assert.assertNull(world.resolve(handle));
		Assert.assertEquals(second, world.resolve(newHandle).ref());
	}

	@Test
	public void ordering() throws Throwable
	{
		ArenaWorld world = new ArenaWorld();
		NamespaceId other = new NamespaceId(2L);
		EntityRef parent = EntityRef.of(APP, 1L);
		world.insert(EntityRecord.create(EntityRef.of(other, 1L), null, Map.of()).withParent(parent));
		world.insert(EntityRecord.create(EntityRef.of(APP, 3L), null, Map.of()).withParent(parent));
		world.insert(EntityRecord.create(parent, null, Map.of()));
		world.insert(EntityRecord.create(EntityRef.of(APP, 2L), null, Map.of()));
		
		Assert.assertEquals(List.of(parent, EntityRef.of(APP, 2L), EntityRef.of(APP, 3L), EntityRef.of(other, 1L)), world.entities());
		Assert.assertEquals(List.of(EntityRef.of(APP, 3L), EntityRef.of(other, 1L)), world.childrenOf(parent));
		Assert.assertTrue(world.childrenOf(EntityRef.of(APP, 2L)).isEmpty());
	}
}
