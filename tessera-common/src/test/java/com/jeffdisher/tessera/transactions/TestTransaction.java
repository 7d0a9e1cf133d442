package com.jeffdisher.tessera.transactions;

import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.tessera.patches.ComponentPatch;
import com.jeffdisher.tessera.patches.EntityPatch;
import com.jeffdisher.tessera.patches.Patch;
import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.TransactionId;
import com.jeffdisher.tessera.types.Value;


public class TestTransaction
{
	private static final NamespaceId NS = new NamespaceId(1L);
	private static final EntityRef ENTITY = EntityRef.of(NS, 1L);

	@Test
	public void lifecycle() throws Throwable
	{
		Transaction transaction = new TransactionBuilder(new TransactionId(1L), NS, 4L)
				.patch(EntityPatch.create(ENTITY))
				.buildDraft()
		;
		Assert.assertEquals(TransactionState.BUILDING, transaction.getState());
		transaction.addPatch(Patch.of(NS, ComponentPatch.set(ENTITY, "Position", Value.vec3(0.0, 0.0, 0.0))));
		transaction.submit();
		Assert.assertEquals(TransactionState.PENDING, transaction.getState());
		Assert.assertEquals(2, transaction.patchCount());
		Assert.assertEquals(Transaction.NOT_APPLIED, transaction.getAppliedFrame());
		
		transaction.beginApplying();
		Assert.assertEquals(TransactionState.APPLYING, transaction.getState());
		transaction.markCommitted(5L);
		Assert.assertEquals(TransactionState.COMMITTED, transaction.getState());
		Assert.assertTrue(transaction.getState().isTerminal());
		Assert.assertEquals(5L, transaction.getAppliedFrame());
	}

	@Test(expected=AssertionError.class)
	public void noPatchesAfterSubmit() throws Throwable
	{
		Transaction transaction = new TransactionBuilder(new TransactionId(1L), NS, 0L).build();
		transaction.addPatch(Patch.of(NS, EntityPatch.create(ENTITY)));
	}

	@Test
	public void cancelAndExpire() throws Throwable
	{
		Transaction draft = new Transaction(new TransactionId(1L), NS, 0L);
		draft.cancel();
		Assert.assertEquals(TransactionState.CANCELLED, draft.getState());
		
		Transaction pending = new TransactionBuilder(new TransactionId(2L), NS, 0L).build();
		pending.expire();
		Assert.assertEquals(TransactionState.CANCELLED, pending.getState());
		Assert.assertTrue(pending.getState().isTerminal());
		Assert.assertFalse(TransactionState.PENDING.isTerminal());
	}

	@Test
	public void rollback() throws Throwable
	{
		Transaction transaction = new TransactionBuilder(new TransactionId(1L), NS, 0L).build();
		transaction.beginApplying();
		transaction.markRolledBack(2L);
		Assert.assertEquals(TransactionState.ROLLED_BACK, transaction.getState());
		Assert.assertEquals(2L, transaction.getAppliedFrame());
	}

	@Test
	public void dependencies() throws Throwable
	{
		TransactionId first = new TransactionId(1L);
		TransactionId second = new TransactionId(2L);
		Transaction transaction = new TransactionBuilder(new TransactionId(3L), NS, 0L)
				.dependsOn(first)
				.dependsOn(second)
				.build()
		;
		Assert.assertFalse(transaction.dependenciesSatisfied(Set.of(first)));
		Assert.assertTrue(transaction.dependenciesSatisfied(Set.of(first, second, new TransactionId(9L))));
	}

	@Test
	public void maxPriority() throws Throwable
	{
		Assert.assertEquals(0, new TransactionBuilder(new TransactionId(1L), NS, 0L).build().maxPriority());
		Transaction transaction = new TransactionBuilder(new TransactionId(2L), NS, 0L)
				.patch(EntityPatch.create(ENTITY), -5)
				.patch(ComponentPatch.remove(ENTITY, "A"), -2)
				.build()
		;
		Assert.assertEquals(-2, transaction.maxPriority());
	}

	@Test
	public void results() throws Throwable
	{
		TransactionResult success = TransactionResult.success(new TransactionId(1L), 3);
		Assert.assertTrue(success.success());
		Assert.assertNull(success.error());
		TransactionResult failure = TransactionResult.failure(new TransactionId(2L), "Entity not found", 1);
		Assert.assertFalse(failure.success());
		Assert.assertEquals(1, failure.patchesApplied());
	}
}
