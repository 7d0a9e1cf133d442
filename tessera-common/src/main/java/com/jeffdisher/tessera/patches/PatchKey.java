package com.jeffdisher.tessera.patches;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.utils.Assert;


/**
 * Identifies the target of a patch for the purpose of merging:  two patches with equal keys write the same thing.
 * Hierarchy and camera patches have no merge key since their effects depend on order relative to other entities.
 */
public record PatchKey(PatchType type, EntityRef entity, String name)
{
	/**
	 * @param patch The patch.
	 * @return The merge key of the patch, or null if it can never be merged.
	 */
	public static PatchKey forMerge(Patch patch)
	{
		IPatchKind kind = patch.kind();
		PatchKey key;
		switch (kind.getType())
		{
		case ENTITY:
			key = new PatchKey(PatchType.ENTITY, ((EntityPatch)kind).entity(), null);
			break;
		case COMPONENT:
			ComponentPatch component = (ComponentPatch)kind;
			key = new PatchKey(PatchType.COMPONENT, component.entity(), component.component());
			break;
		case LAYER:
			key = new PatchKey(PatchType.LAYER, null, ((LayerPatch)kind).layerId());
			break;
		case ASSET:
			key = new PatchKey(PatchType.ASSET, null, ((AssetPatch)kind).assetId());
			break;
		case HIERARCHY:
		case CAMERA:
			key = null;
			break;
		default:
			throw Assert.unreachable();
		}
		return key;
	}
}
