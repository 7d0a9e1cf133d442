package com.jeffdisher.tessera.namespaces;

import java.util.Set;

import com.jeffdisher.tessera.types.NamespaceId;


/**
 * Who an exported entity is visible to:  everyone, an explicit set of namespaces, or any namespace holding a given
 * kind of capability.
 */
public record ExportAccess(Policy policy
		, Set<NamespaceId> allowlist
		, CapabilityKind requiredCapability
)
{
	public enum Policy
	{
		PUBLIC,
		ALLOWLIST,
		CAPABILITY_REQUIRED,
	}

	public static ExportAccess publicAccess()
	{
		return new ExportAccess(Policy.PUBLIC, Set.of(), null);
	}

	public static ExportAccess allowlist(Set<NamespaceId> namespaces)
	{
		return new ExportAccess(Policy.ALLOWLIST, Set.copyOf(namespaces), null);
	}

	public static ExportAccess capabilityRequired(CapabilityKind kind)
	{
		return new ExportAccess(Policy.CAPABILITY_REQUIRED, Set.of(), kind);
	}
}
