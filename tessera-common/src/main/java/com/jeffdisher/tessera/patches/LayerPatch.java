package com.jeffdisher.tessera.patches;

import com.jeffdisher.tessera.types.EntityRef;


/**
 * Creates, updates or destroys a render layer.
 * For UPDATE, any null field is left unchanged.  For CREATE, a null visible/blendMode means the default (visible,
 * NORMAL).
 */
public record LayerPatch(String layerId
		, Op op
		, LayerType layerType
		, Integer priority
		, Boolean visible
		, BlendMode blendMode
) implements IPatchKind
{
	public enum Op
	{
		CREATE,
		UPDATE,
		DESTROY,
	}

	public static LayerPatch create(String layerId, LayerType layerType, int priority)
	{
		return new LayerPatch(layerId, Op.CREATE, layerType, priority, null, null);
	}

	public static LayerPatch update(String layerId, Integer priority, Boolean visible, BlendMode blendMode)
	{
		return new LayerPatch(layerId, Op.UPDATE, null, priority, visible, blendMode);
	}

	public static LayerPatch destroy(String layerId)
	{
		return new LayerPatch(layerId, Op.DESTROY, null, null, null, null);
	}

	/**
	 * Returns a copy with the non-null fields of the given UPDATE written over this patch's fields.
	 * 
	 * @param update An UPDATE patch for the same layer.
	 * @return The combined patch (same op as the receiver).
	 */
	public LayerPatch withFieldsFrom(LayerPatch update)
	{
		return new LayerPatch(this.layerId
				, this.op
				, this.layerType
				, (null != update.priority) ? update.priority : this.priority
				, (null != update.visible) ? update.visible : this.visible
				, (null != update.blendMode) ? update.blendMode : this.blendMode
		);
	}

	@Override
	public PatchType getType()
	{
		return PatchType.LAYER;
	}

	@Override
	public EntityRef targetEntity()
	{
		return null;
	}
}
