// File: src/main/java/com/juanpa/spice/transpiler/semantics/TypeChecker.java

package com.juanpa.spice.transpiler.semantics;

import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.ast.declarations.ClassDeclaration;
import com.juanpa.spice.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.spice.transpiler.ast.declarations.InterfaceDeclaration;
import com.juanpa.spice.transpiler.ast.declarations.MethodSignature;
import com.juanpa.spice.transpiler.ast.expressions.Expression;
import com.juanpa.spice.transpiler.ast.statements.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Nominal type checker. It does not infer expression types; it registers the interfaces and
 * classes declared at the top level and verifies that every class implements the methods of
 * the interfaces it names.
 * <p>
 * Problems are routed by the {@link TypeEnforcement} level: dropped for NONE, collected as
 * warnings for WARNINGS, collected as errors for STRICT.
 */
public class TypeChecker
{
	private static final Logger logger = LoggerFactory.getLogger(TypeChecker.class);

	private final TypeEnforcement enforcement;
	private final Map<String, SpiceType> symbolTable = new LinkedHashMap<>();
	private final Map<String, List<String>> interfaceBases = new LinkedHashMap<>();
	private final Map<String, List<String>> classBases = new LinkedHashMap<>();
	private final List<String> errors = new ArrayList<>();
	private final List<String> warnings = new ArrayList<>();

	public TypeChecker(TypeEnforcement enforcement)
	{
		this.enforcement = enforcement;
	}

	public TypeEnforcement getEnforcement()
	{
		return enforcement;
	}

	/**
	 * Registers the program's interfaces and classes, then validates interface implementations.
	 * Previous results are discarded.
	 *
	 * @param program The parsed program.
	 */
	public void check(Program program)
	{
		symbolTable.clear();
		interfaceBases.clear();
		classBases.clear();
		errors.clear();
		warnings.clear();

		if (enforcement == TypeEnforcement.NONE)
		{
			return;
		}

		List<ClassDeclaration> classes = new ArrayList<>();
		for (Statement statement : program.getBody())
		{
			if (statement instanceof InterfaceDeclaration)
			{
				registerInterface((InterfaceDeclaration) statement);
			}
			else if (statement instanceof ClassDeclaration)
			{
				ClassDeclaration declaration = (ClassDeclaration) statement;
				registerClass(declaration);
				classes.add(declaration);
			}
		}

		for (ClassDeclaration declaration : classes)
		{
			for (String interfaceName : declaration.getInterfaces())
			{
				validateInterfaceImplementation(declaration.getName(), interfaceName);
			}
		}
		logger.debug("Type check finished with {} error(s) and {} warning(s)", errors.size(), warnings.size());
	}

	private void registerInterface(InterfaceDeclaration declaration)
	{
		SpiceType type = new SpiceType(TypeKind.PROTOCOL, declaration.getName());
		for (MethodSignature signature : declaration.getMethods())
		{
			type.addMethod(signature.getName(), new SpiceType(TypeKind.CALLABLE, signature.getName()));
		}
		symbolTable.put(declaration.getName(), type);
		interfaceBases.put(declaration.getName(), declaration.getBaseInterfaces());
		logger.debug("Registered interface '{}' with {} method(s)", declaration.getName(), declaration.getMethods().size());
	}

	private void registerClass(ClassDeclaration declaration)
	{
		SpiceType type = new SpiceType(TypeKind.CLASS, declaration.getName());
		for (Statement member : declaration.getMembers())
		{
			if (member instanceof FunctionDeclaration)
			{
				String name = ((FunctionDeclaration) member).getName();
				type.addMethod(name, new SpiceType(TypeKind.CALLABLE, name));
			}
		}
		symbolTable.put(declaration.getName(), type);
		classBases.put(declaration.getName(), declaration.getBases());
		logger.debug("Registered class '{}'", declaration.getName());
	}

	/**
	 * Reports every method of the interface (and of its known base interfaces) that the class
	 * neither defines nor inherits from a known base class. Unknown names are assumed to come
	 * from imports and are skipped.
	 *
	 * @param className     The implementing class.
	 * @param interfaceName The interface it claims to implement.
	 */
	public void validateInterfaceImplementation(String className, String interfaceName)
	{
		SpiceType interfaceType = symbolTable.get(interfaceName);
		if (symbolTable.get(className) == null || interfaceType == null || interfaceType.getKind() != TypeKind.PROTOCOL)
		{
			return;
		}

		Set<String> provided = collectClassMethods(className, new HashSet<>());
		for (String method : collectInterfaceMethods(interfaceName, new HashSet<>()))
		{
			if (!provided.contains(method))
			{
				report("Class '" + className + "' does not implement method '" + method + "' of interface '" + interfaceName + "'");
			}
		}
	}

	private Set<String> collectInterfaceMethods(String interfaceName, Set<String> visited)
	{
		Set<String> methods = new LinkedHashSet<>();
		SpiceType type = symbolTable.get(interfaceName);
		if (type == null || type.getKind() != TypeKind.PROTOCOL || !visited.add(interfaceName))
		{
			return methods;
		}
		methods.addAll(type.getMethods().keySet());
		for (String base : interfaceBases.getOrDefault(interfaceName, Collections.emptyList()))
		{
			methods.addAll(collectInterfaceMethods(base, visited));
		}
		return methods;
	}

	private Set<String> collectClassMethods(String className, Set<String> visited)
	{
		Set<String> methods = new HashSet<>();
		SpiceType type = symbolTable.get(className);
		if (type == null || type.getKind() != TypeKind.CLASS || !visited.add(className))
		{
			return methods;
		}
		methods.addAll(type.getMethods().keySet());
		for (String base : classBases.getOrDefault(className, Collections.emptyList()))
		{
			methods.addAll(collectClassMethods(base, visited));
		}
		return methods;
	}

	/**
	 * @param target   Declared type of the target.
	 * @param value    Type of the assigned value.
	 * @param location Human-readable position, may be empty.
	 */
	public void checkAssignment(SpiceType target, SpiceType value, String location)
	{
		if (!value.isAssignableTo(target))
		{
			report("Type mismatch" + at(location) + ": Cannot assign " + value + " to " + target);
		}
	}

	/**
	 * Expression types are not inferred yet.
	 *
	 * @param expression Any expression.
	 * @return Always {@link SpiceType#ANY}.
	 */
	public SpiceType inferType(Expression expression)
	{
		return SpiceType.ANY;
	}

	/**
	 * Looks up a field, then a method, on the given type.
	 *
	 * @return The member type, or null after reporting the missing attribute.
	 */
	public SpiceType resolveAttribute(SpiceType objectType, String attribute, String location)
	{
		SpiceType field = objectType.getField(attribute);
		if (field != null)
		{
			return field;
		}
		SpiceType method = objectType.getMethod(attribute);
		if (method != null)
		{
			return method;
		}
		report("Attribute '" + attribute + "' not found on type " + objectType + at(location));
		return null;
	}

	public SpiceType lookup(String name)
	{
		return symbolTable.get(name);
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	private static String at(String location)
	{
		return location == null || location.isEmpty() ? "" : " at " + location;
	}

	private void report(String message)
	{
		switch (enforcement)
		{
			case STRICT:
				errors.add(message);
				break;
			case WARNINGS:
				warnings.add(message);
				break;
			default:
				logger.debug("Ignored type problem: {}", message);
				break;
		}
	}
}
