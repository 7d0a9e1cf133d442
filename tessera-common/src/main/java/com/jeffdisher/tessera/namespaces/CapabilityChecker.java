package com.jeffdisher.tessera.namespaces;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

import com.jeffdisher.tessera.logic.MonotonicIdAssigner;
import com.jeffdisher.tessera.types.CapabilityId;
import com.jeffdisher.tessera.types.NamespaceId;


/**
 * Holds every capability grant, indexed by holder, and answers "may this namespace do this?" questions.
 * The KERNEL namespace always passes and a KERNEL_ADMIN grant satisfies any check.  Denied checks are kept in a
 * bounded audit log for operators.
 * Calls can come from the kernel thread and from monitoring threads so the public methods are synchronized.
 */
public class CapabilityChecker
{
	public static final int AUDIT_LOG_SIZE = 256;

	private final MonotonicIdAssigner _ids;
	private final LongSupplier _currentTimeMillisProvider;
	private final Map<NamespaceId, List<Capability>> _byHolder = new HashMap<>();
	private final Map<CapabilityId, Capability> _byId = new HashMap<>();
	private final ArrayDeque<AuditEntry> _audit = new ArrayDeque<>();

	public CapabilityChecker(MonotonicIdAssigner ids, LongSupplier currentTimeMillisProvider)
	{
		_ids = ids;
		_currentTimeMillisProvider = currentTimeMillisProvider;
	}

	/**
	 * Grants a capability.  The grantor must be KERNEL or hold MANAGE_CAPABILITIES, and can only pass on kinds it
	 * holds as delegable (a KERNEL_ADMIN holder can pass on anything).
	 * 
	 * @param holder The namespace receiving the grant.
	 * @param grantor The namespace making the grant.
	 * @param grant The terms of the grant.
	 * @return The id of the new capability, or null if the grantor isn't allowed to make this grant.
	 */
	public synchronized CapabilityId grant(NamespaceId holder, NamespaceId grantor, CapabilityGrant grant)
	{
		if (!grantor.isKernel())
		{
			boolean canManage = _check(grantor, CapabilityKind.MANAGE_CAPABILITIES, null, null, 0).isAllowed();
			boolean canDelegate = _holdsDelegable(grantor, grant.kind());
			if (!canManage || !canDelegate)
			{
				_audit(grantor, CapabilityKind.MANAGE_CAPABILITIES, CapabilityCheck.DENIED);
				return null;
			}
		}
		CapabilityId id = new CapabilityId(_ids.next());
		Capability capability = new Capability(id, holder, grantor, grant);
		_byHolder.computeIfAbsent(holder, (NamespaceId ignored) -> new ArrayList<>()).add(capability);
		_byId.put(id, capability);
		return id;
	}

	/**
	 * Grants the set every new application namespace starts with:  managing its own entities, components, layers and
	 * assets.
	 * 
	 * @param holder The new namespace.
	 */
	public synchronized void grantDefaultAppCapabilities(NamespaceId holder)
	{
		CapabilityKind[] defaults = new CapabilityKind[] {
				CapabilityKind.CREATE_ENTITIES,
				CapabilityKind.DESTROY_ENTITIES,
				CapabilityKind.MODIFY_COMPONENTS,
				CapabilityKind.CREATE_LAYERS,
				CapabilityKind.LOAD_ASSETS,
		};
		for (CapabilityKind kind : defaults)
		{
			grant(holder, NamespaceId.KERNEL, CapabilityGrant.of(kind).withReason("default application grant"));
		}
	}

	/**
	 * @return True if the capability existed and was revoked.
	 */
	public synchronized boolean revoke(CapabilityId id)
	{
		Capability capability = _byId.remove(id);
		if (null != capability)
		{
			List<Capability> held = _byHolder.get(capability.holder());
			held.remove(capability);
			if (held.isEmpty())
			{
				_byHolder.remove(capability.holder());
			}
		}
		return (null != capability);
	}

	/**
	 * @return The number of capabilities revoked.
	 */
	public synchronized int revokeAll(NamespaceId holder)
	{
		List<Capability> held = _byHolder.remove(holder);
		int count = 0;
		if (null != held)
		{
			for (Capability capability : held)
			{
				_byId.remove(capability.id());
			}
			count = held.size();
		}
		return count;
	}

	/**
	 * Drops every expired grant.
	 * 
	 * @return The number of grants dropped.
	 */
	public synchronized int pruneExpired()
	{
		long now = _currentTimeMillisProvider.getAsLong();
		int count = 0;
		Iterator<Map.Entry<NamespaceId, List<Capability>>> iterator = _byHolder.entrySet().iterator();
		while (iterator.hasNext())
		{
			List<Capability> held = iterator.next().getValue();
			Iterator<Capability> inner = held.iterator();
			while (inner.hasNext())
			{
				Capability capability = inner.next();
				if (capability.isExpired(now))
				{
					inner.remove();
					_byId.remove(capability.id());
					count += 1;
				}
			}
			if (held.isEmpty())
			{
				iterator.remove();
			}
		}
		return count;
	}

	public synchronized CapabilityCheck check(NamespaceId holder, CapabilityKind kind)
	{
		return _checkAndAudit(holder, kind, null, null, 0);
	}

	/**
	 * Checks a capability whose grant may be narrowed to specific components, layers or asset paths.
	 */
	public synchronized CapabilityCheck checkScoped(NamespaceId holder, CapabilityKind kind, String scopeItem)
	{
		return _checkAndAudit(holder, kind, scopeItem, null, 0);
	}

	/**
	 * Checks a quota-style capability.
	 * 
	 * @param currentCount How many of the limited thing the holder already has.
	 */
	public synchronized CapabilityCheck checkQuota(NamespaceId holder, CapabilityKind kind, int currentCount)
	{
		return _checkAndAudit(holder, kind, null, null, currentCount);
	}

	/**
	 * Checks whether holder may read entities in target.  A failure here is normal (it just means "look for an export")
	 * so it is not audited.
	 */
	public synchronized CapabilityCheck checkCrossNamespaceRead(NamespaceId holder, NamespaceId target)
	{
		return _check(holder, CapabilityKind.CROSS_NAMESPACE_READ, null, target, 0);
	}

	public synchronized boolean hasCapability(NamespaceId holder, CapabilityKind kind)
	{
		return _check(holder, kind, null, null, 0).isAllowed();
	}

	public synchronized List<Capability> getCapabilities(NamespaceId holder)
	{
		List<Capability> held = _byHolder.get(holder);
		return (null != held) ? new ArrayList<>(held) : List.of();
	}

	public synchronized Capability getCapability(CapabilityId id)
	{
		return _byId.get(id);
	}

	public synchronized int totalCount()
	{
		return _byId.size();
	}

	public synchronized List<AuditEntry> getAuditLog()
	{
		return new ArrayList<>(_audit);
	}


	private CapabilityCheck _checkAndAudit(NamespaceId holder, CapabilityKind kind, String scopeItem, NamespaceId target, int currentCount)
	{
		CapabilityCheck result = _check(holder, kind, scopeItem, target, currentCount);
		if (!result.isAllowed())
		{
			_audit(holder, kind, result);
		}
		return result;
	}

	private CapabilityCheck _check(NamespaceId holder, CapabilityKind kind, String scopeItem, NamespaceId target, int currentCount)
	{
		if (holder.isKernel())
		{
			return CapabilityCheck.ALLOWED;
		}
		List<Capability> held = _byHolder.get(holder);
		if (null == held)
		{
			return CapabilityCheck.DENIED;
		}
		long now = _currentTimeMillisProvider.getAsLong();
		boolean sawExpired = false;
		boolean sawQuota = false;
		for (Capability capability : held)
		{
			boolean matchesKind = (kind == capability.kind()) || (CapabilityKind.KERNEL_ADMIN == capability.kind());
			if (!matchesKind)
			{
				continue;
			}
			if (capability.isExpired(now))
			{
				sawExpired = true;
			}
			else if (CapabilityKind.KERNEL_ADMIN == capability.kind())
			{
				return CapabilityCheck.ALLOWED;
			}
			else if (capability.covers(scopeItem, target))
			{
				int max = capability.grant().max();
				if ((0 != max) && (currentCount >= max))
				{
					sawQuota = true;
				}
				else
				{
					return CapabilityCheck.ALLOWED;
				}
			}
		}
		CapabilityCheck result;
		if (sawQuota)
		{
			result = CapabilityCheck.QUOTA_EXCEEDED;
		}
		else if (sawExpired)
		{
			result = CapabilityCheck.EXPIRED;
		}
		else
		{
			result = CapabilityCheck.DENIED;
		}
		return result;
	}

	private boolean _holdsDelegable(NamespaceId holder, CapabilityKind kind)
	{
		List<Capability> held = _byHolder.get(holder);
		boolean found = false;
		if (null != held)
		{
			long now = _currentTimeMillisProvider.getAsLong();
			for (Capability capability : held)
			{
				boolean usable = !capability.isExpired(now);
				if (usable && ((CapabilityKind.KERNEL_ADMIN == capability.kind()) || ((kind == capability.kind()) && capability.grant().delegable())))
				{
					found = true;
					break;
				}
			}
		}
		return found;
	}

	private void _audit(NamespaceId holder, CapabilityKind kind, CapabilityCheck result)
	{
		if (_audit.size() >= AUDIT_LOG_SIZE)
		{
			_audit.removeFirst();
		}
		_audit.addLast(new AuditEntry(holder, kind, result, _currentTimeMillisProvider.getAsLong()));
	}


	/**
	 * One denied check.
	 */
	public static record AuditEntry(NamespaceId holder, CapabilityKind kind, CapabilityCheck result, long millis)
	{
	}
}
