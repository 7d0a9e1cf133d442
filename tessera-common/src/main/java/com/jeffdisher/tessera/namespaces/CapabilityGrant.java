package com.jeffdisher.tessera.namespaces;

import java.util.Set;

import com.jeffdisher.tessera.types.NamespaceId;


/**
 * The terms of a grant, before it is assigned an id and a holder.
 * scope and namespaces narrow the grant (empty means unrestricted), max bounds quota-style kinds (0 is unlimited)
 * and expiresAtMillis is the wall-clock expiry (0 never expires).
 */
public record CapabilityGrant(CapabilityKind kind
		, Set<String> scope
		, Set<NamespaceId> namespaces
		, int max
		, long expiresAtMillis
		, boolean delegable
		, String reason
)
{
	public static CapabilityGrant of(CapabilityKind kind)
	{
		return new CapabilityGrant(kind, Set.of(), Set.of(), 0, 0L, false, null);
	}

	public static CapabilityGrant scoped(CapabilityKind kind, Set<String> scope)
	{
		return new CapabilityGrant(kind, scope, Set.of(), 0, 0L, false, null);
	}

	public static CapabilityGrant limited(CapabilityKind kind, int max)
	{
		return new CapabilityGrant(kind, Set.of(), Set.of(), max, 0L, false, null);
	}

	public static CapabilityGrant crossNamespaceRead(Set<NamespaceId> namespaces)
	{
		return new CapabilityGrant(CapabilityKind.CROSS_NAMESPACE_READ, Set.of(), namespaces, 0, 0L, false, null);
	}

	public CapabilityGrant
	{
		scope = Set.copyOf(scope);
		namespaces = Set.copyOf(namespaces);
	}

	public CapabilityGrant expiringAt(long millis)
	{
		return new CapabilityGrant(this.kind, this.scope, this.namespaces, this.max, millis, this.delegable, this.reason);
	}

	public CapabilityGrant asDelegable()
	{
		return new CapabilityGrant(this.kind, this.scope, this.namespaces, this.max, this.expiresAtMillis, true, this.reason);
	}

	public CapabilityGrant withReason(String reason)
	{
		return new CapabilityGrant(this.kind, this.scope, this.namespaces, this.max, this.expiresAtMillis, this.delegable, reason);
	}
}
