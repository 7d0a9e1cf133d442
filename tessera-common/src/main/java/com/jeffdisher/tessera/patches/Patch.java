package com.jeffdisher.tessera.patches;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.NamespaceId;


/**
 * The smallest unit of declarative world mutation:  what to change (kind), who is asking (source), how urgently
 * (priority, higher first) and when it was created (timestamp, in wall-clock millis).
 * Priority only changes ordering, never what the source is permitted to do.
 */
public record Patch(NamespaceId source
		, IPatchKind kind
		, int priority
		, long timestamp
)
{
	public static Patch of(NamespaceId source, IPatchKind kind)
	{
		return new Patch(source, kind, 0, System.currentTimeMillis());
	}

	public static Patch of(NamespaceId source, IPatchKind kind, int priority)
	{
		return new Patch(source, kind, priority, System.currentTimeMillis());
	}

	public Patch withPriority(int priority)
	{
		return new Patch(this.source, this.kind, priority, this.timestamp);
	}

	public Patch withKind(IPatchKind kind)
	{
		return new Patch(this.source, kind, this.priority, this.timestamp);
	}

	public PatchType getType()
	{
		return this.kind.getType();
	}

	public EntityRef targetEntity()
	{
		return this.kind.targetEntity();
	}

	public boolean targetsEntity(EntityRef entity)
	{
		return entity.equals(this.kind.targetEntity());
	}
}
