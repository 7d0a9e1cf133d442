package com.jeffdisher.tessera.namespaces;

import java.util.Map;
import java.util.Set;

import com.jeffdisher.tessera.types.NamespaceId;


/**
 * A read-only copy of one namespace's registration:  what it owns and what it exports.
 */
public record NamespaceInfo(NamespaceId id
		, String name
		, ResourceLimits limits
		, Set<Long> entities
		, Set<String> layers
		, Set<String> assets
		, Map<Long, EntityExport> exports
)
{
}
