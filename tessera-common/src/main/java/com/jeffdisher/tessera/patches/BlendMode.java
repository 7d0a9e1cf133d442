package com.jeffdisher.tessera.patches;


public enum BlendMode
{
	NORMAL,
	ADDITIVE,
	MULTIPLY,
	SCREEN,
	REPLACE,
}
