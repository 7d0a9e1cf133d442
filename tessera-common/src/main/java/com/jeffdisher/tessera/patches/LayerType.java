package com.jeffdisher.tessera.patches;


public enum LayerType
{
	CONTENT,
	EFFECT,
	OVERLAY,
	PORTAL,
}
