package com.juanpa.spice.transpiler.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A nominal type: kind, name, optional generic parameters and the fields and methods
 * known for it. Methods are recorded by name with a CALLABLE type.
 */
public class SpiceType
{
	public static final SpiceType ANY = new SpiceType(TypeKind.ANY, "any");

	private final TypeKind kind;
	private final String name;
	private final List<SpiceType> params;
	private final Map<String, SpiceType> fields = new LinkedHashMap<>();
	private final Map<String, SpiceType> methods = new LinkedHashMap<>();

	public SpiceType(TypeKind kind, String name)
	{
		this(kind, name, new ArrayList<>());
	}

	public SpiceType(TypeKind kind, String name, List<SpiceType> params)
	{
		this.kind = kind;
		this.name = name;
		this.params = new ArrayList<>(params);
	}

	public TypeKind getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name;
	}

	public List<SpiceType> getParams()
	{
		return Collections.unmodifiableList(params);
	}

	/**
	 * ANY converts both ways; otherwise kind and name must match exactly.
	 * Inheritance and protocol compatibility are not modelled.
	 *
	 * @param other The target type.
	 * @return True if a value of this type may be assigned to the target.
	 */
	public boolean isAssignableTo(SpiceType other)
	{
		if (kind == TypeKind.ANY || other.kind == TypeKind.ANY)
		{
			return true;
		}
		return kind == other.kind && name.equals(other.name);
	}

	public void addField(String fieldName, SpiceType type)
	{
		fields.put(fieldName, type);
	}

	public void addMethod(String methodName, SpiceType type)
	{
		methods.put(methodName, type);
	}

	public SpiceType getField(String fieldName)
	{
		return fields.get(fieldName);
	}

	public SpiceType getMethod(String methodName)
	{
		return methods.get(methodName);
	}

	public Map<String, SpiceType> getMethods()
	{
		return Collections.unmodifiableMap(methods);
	}

	@Override
	public String toString()
	{
		if (params.isEmpty())
		{
			return name;
		}
		return name + "[" + params.stream().map(SpiceType::toString).collect(Collectors.joining(", ")) + "]";
	}
}
