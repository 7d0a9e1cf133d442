package com.jeffdisher.tessera.patches;

import java.util.List;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.Value;


/**
 * Changes the camera state of an entity.  The camera is stored as an OBJECT component named CAMERA_COMPONENT and each
 * op writes one of its fields from "argument".
 */
public record CameraPatch(EntityRef entity
		, Op op
		, Value argument
) implements IPatchKind
{
	public static final String CAMERA_COMPONENT = "Camera";
	public static final String FIELD_MAIN = "main";
	public static final String FIELD_ACTIVE = "active";
	public static final String FIELD_PROJECTION = "projection";
	public static final String FIELD_FOV = "fov";
	public static final String FIELD_HEIGHT = "height";
	public static final String FIELD_NEAR = "near";
	public static final String FIELD_FAR = "far";
	public static final String FIELD_PRIORITY = "priority";
	public static final String PROJECTION_PERSPECTIVE = "perspective";
	public static final String PROJECTION_ORTHOGRAPHIC = "orthographic";

	public enum Op
	{
		SET_MAIN,
		CLEAR_MAIN,
		SET_ACTIVE,
		SET_PERSPECTIVE,
		SET_ORTHOGRAPHIC,
		SET_CLIP_PLANES,
		SET_PRIORITY,
	}

	public static CameraPatch setMain(EntityRef entity)
	{
		return new CameraPatch(entity, Op.SET_MAIN, Value.NULL);
	}

	public static CameraPatch clearMain(EntityRef entity)
	{
		return new CameraPatch(entity, Op.CLEAR_MAIN, Value.NULL);
	}

	public static CameraPatch setActive(EntityRef entity, boolean active)
	{
		return new CameraPatch(entity, Op.SET_ACTIVE, Value.ofBool(active));
	}

	public static CameraPatch setPerspective(EntityRef entity, double fovDegrees)
	{
		return new CameraPatch(entity, Op.SET_PERSPECTIVE, Value.ofFloat(fovDegrees));
	}

	public static CameraPatch setOrthographic(EntityRef entity, double height)
	{
		return new CameraPatch(entity, Op.SET_ORTHOGRAPHIC, Value.ofFloat(height));
	}

	public static CameraPatch setClipPlanes(EntityRef entity, double near, double far)
	{
		return new CameraPatch(entity, Op.SET_CLIP_PLANES, Value.ofArray(List.of(Value.ofFloat(near), Value.ofFloat(far))));
	}

	public static CameraPatch setPriority(EntityRef entity, int priority)
	{
		return new CameraPatch(entity, Op.SET_PRIORITY, Value.ofInt(priority));
	}

	@Override
	public PatchType getType()
	{
		return PatchType.CAMERA;
	}

	@Override
	public EntityRef targetEntity()
	{
		return this.entity;
	}
}
