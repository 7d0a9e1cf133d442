package com.jeffdisher.tessera.world;

import com.jeffdisher.tessera.patches.BlendMode;
import com.jeffdisher.tessera.patches.LayerType;
import com.jeffdisher.tessera.types.NamespaceId;


public record LayerState(String id
		, NamespaceId owner
		, LayerType layerType
		, int priority
		, boolean visible
		, BlendMode blendMode
)
{
}
