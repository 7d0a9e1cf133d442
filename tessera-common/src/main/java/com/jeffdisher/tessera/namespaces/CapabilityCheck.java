package com.jeffdisher.tessera.namespaces;


public enum CapabilityCheck
{
	ALLOWED,
	DENIED,
	QUOTA_EXCEEDED,
	EXPIRED,
	;

	public boolean isAllowed()
	{
		return ALLOWED == this;
	}
}
