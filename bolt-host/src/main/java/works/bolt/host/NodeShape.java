package works.bolt.host;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

/**
 * Reflective description of a node type: its attributes in declaration order,
 * and how to read them and rebuild the node from them.
 * <p>
 * Non-record nodes have no attributes as far as generic tree walkers are concerned.
 */
final class NodeShape {
	final Class<?> nodeType;
	final List<Component> components;
	@Nullable final MethodHandle constructor;

	/**
	 * @param elementType for {@link AstChildren} attributes, the declared element type;
	 *                    otherwise the same as {@code type}
	 */
	record Component(String name, Class<?> type, Class<?> elementType, MethodHandle accessor) {
		boolean holdsChildren() {
			return type == AstChildren.class;
		}
	}

	private NodeShape(Class<?> nodeType, List<Component> components, @Nullable MethodHandle constructor) {
		this.nodeType = nodeType;
		this.components = components;
		this.constructor = constructor;
	}

	static NodeShape of(Class<?> nodeType) {
		return SHAPES.get(nodeType);
	}

	boolean isRebuildable() {
		return constructor != null;
	}

	Object[] values(AstNode node) {
		Object[] result = new Object[components.size()];
		for (int i = 0; i < result.length; i++) {
			result[i] = read(components.get(i), node);
		}
		return result;
	}

	AstChildren<AstNode> children(AstNode node) {
		List<AstNode> result = new ArrayList<>();
		for (Component component: components) {
			Object value = read(component, node);
			if (value instanceof AstChildren<?> children) {
				result.addAll(children);
			} else if (value instanceof AstNode child) {
				result.add(child);
			}
		}
		return AstChildren.from(result);
	}

	/**
	 * @throws ClassCastException if some value doesn't fit its component
	 */
	AstNode construct(Object[] values) {
		assert constructor != null: "Can't construct non-record node " + nodeType;
		try {
			return (AstNode) constructor.invokeWithArguments(values);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unexpected exception constructing " + nodeType.getSimpleName(), e);
		}
	}

	private static Object read(Component component, AstNode node) {
		try {
			return component.accessor().invoke(node);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unexpected exception reading " + component.name(), e);
		}
	}

	private static NodeShape compute(Class<?> nodeType) {
		if (!nodeType.isRecord()) {
			return new NodeShape(nodeType, List.of(), null);
		}
		var lookup = MethodHandles.publicLookup();
		RecordComponent[] rcs = nodeType.getRecordComponents();
		List<Component> components = new ArrayList<>(rcs.length);
		for (RecordComponent rc: rcs) {
			MethodHandle accessor;
			try {
				accessor = lookup.unreflect(rc.getAccessor());
			} catch (IllegalAccessException e) {
				throw new IllegalArgumentException("Can't access accessor " + rc.getAccessor() + " of " + nodeType + "; node types must be public", e);
			}
			components.add(new Component(rc.getName(), rc.getType(), elementType(rc), accessor));
		}
		MethodHandle constructor;
		try {
			constructor = lookup.findConstructor(nodeType, MethodType.methodType(void.class, Stream.of(rcs)
				.map(RecordComponent::getType).toArray(Class<?>[]::new)
			));
		} catch (NoSuchMethodException e) {
			throw new AssertionError("Canonical constructor must exist for " + nodeType);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Can't access canonical constructor of " + nodeType, e);
		}
		return new NodeShape(nodeType, List.copyOf(components), constructor);
	}

	private static Class<?> elementType(RecordComponent rc) {
		if (rc.getType() != AstChildren.class) {
			return rc.getType();
		}
		if (rc.getGenericType() instanceof ParameterizedType p) {
			Type arg = p.getActualTypeArguments()[0];
			if (arg instanceof WildcardType w) {
				arg = w.getUpperBounds()[0];
			}
			if (arg instanceof Class<?> c) {
				return c;
			} else if (arg instanceof ParameterizedType pa && pa.getRawType() instanceof Class<?> c) {
				return c;
			}
		}
		return AstNode.class;
	}

	private static final ClassValue<NodeShape> SHAPES = new ClassValue<>() {
		@Override
		protected NodeShape computeValue(Class<?> type) {
			return compute(type);
		}
	};
}
