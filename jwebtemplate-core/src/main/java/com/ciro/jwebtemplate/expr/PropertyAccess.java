package com.ciro.jwebtemplate.expr;

import com.ciro.jwebtemplate.exception.EvaluationException;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reads members of dynamic values: map keys, list indexes, record accessors, bean getters
 * and public fields. Also dispatches method calls by name and arity.
 */
final class PropertyAccess {

    private PropertyAccess() {}

    static Object get(Object obj, String name) {
        if (obj == null) return null;
        if (obj instanceof Map<?, ?> m) return m.get(name);
        if (obj instanceof String s && name.equals("length")) return s.length();
        if (obj instanceof Collection<?> c && (name.equals("length") || name.equals("size"))) return c.size();
        if (obj.getClass().isArray() && name.equals("length")) return Array.getLength(obj);
        if (isIndex(name) && (obj instanceof List<?> || obj.getClass().isArray())) {
            return index(obj, Integer.parseInt(name));
        }

        Class<?> c = obj.getClass();
        Method m = findGetter(c, name);
        if (m != null) return invoke(m, obj);

        Field f = findField(c, name);
        if (f != null) {
            try {
                return f.get(obj);
            } catch (IllegalAccessException e) {
                throw new EvaluationException("Cannot read field '" + name + "' of " + c.getName(), e);
            }
        }
        return null;
    }

    static Object index(Object obj, Object key) {
        if (obj == null) return null;
        if (obj instanceof Map<?, ?> m) {
            if (m.containsKey(key)) return m.get(key);
            return m.get(TemplateValues.toText(key));
        }
        if (key instanceof Number n) {
            int i = n.intValue();
            if (obj instanceof List<?> l) return i >= 0 && i < l.size() ? l.get(i) : null;
            if (obj.getClass().isArray()) return i >= 0 && i < Array.getLength(obj) ? Array.get(obj, i) : null;
            if (obj instanceof String s) return i >= 0 && i < s.length() ? String.valueOf(s.charAt(i)) : null;
        }
        return get(obj, TemplateValues.toText(key));
    }

    @SuppressWarnings("unchecked")
    static void set(Object obj, Object key, Object value) {
        if (obj instanceof Map<?, ?> m) {
            ((Map<Object, Object>) m).put(key instanceof String ? key : TemplateValues.toText(key), value);
            return;
        }
        if (obj instanceof List<?> l && key instanceof Number n) {
            ((List<Object>) l).set(n.intValue(), value);
            return;
        }
        throw new EvaluationException("Cannot assign '" + key + "' on "
                + (obj == null ? "null" : obj.getClass().getSimpleName()));
    }

    static Object call(Object target, String name, List<Object> args) {
        if (target == null) {
            throw new EvaluationException("Cannot call '" + name + "' on null");
        }
        if (target instanceof Map<?, ?> m && m.get(name) instanceof TemplateFunction fn) {
            return fn.call(args);
        }
        for (Method m : target.getClass().getMethods()) {
            if (!m.getName().equals(name) || m.getParameterCount() != args.size() || Modifier.isStatic(m.getModifiers())) {
                continue;
            }
            Object[] coerced = coerceAll(m.getParameterTypes(), args);
            if (coerced != null) {
                return invoke(m, target, coerced);
            }
        }
        throw new EvaluationException("No method '" + name + "' taking " + args.size()
                + " argument(s) on " + target.getClass().getSimpleName());
    }

    private static Object invoke(Method m, Object target, Object... args) {
        try {
            return accessible(m).invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new EvaluationException("Call to " + m.getName() + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new EvaluationException("Cannot access " + m.getName() + " on " + target.getClass().getName(), e);
        }
    }

    /** Same method seen through a public type, so non-public implementations stay callable. */
    private static Method accessible(Method m) {
        if (Modifier.isPublic(m.getDeclaringClass().getModifiers())) return m;
        for (Class<?> c = m.getDeclaringClass(); c != null; c = c.getSuperclass()) {
            Method found = viaPublicType(c, m);
            if (found != null) return found;
        }
        m.trySetAccessible();
        return m;
    }

    private static Method viaPublicType(Class<?> type, Method m) {
        if (Modifier.isPublic(type.getModifiers())) {
            try {
                return type.getMethod(m.getName(), m.getParameterTypes());
            } catch (NoSuchMethodException ignored) {
                // not declared on this type, keep looking through its interfaces
            }
        }
        for (Class<?> i : type.getInterfaces()) {
            Method found = viaPublicType(i, m);
            if (found != null) return found;
        }
        return null;
    }

    private static Object[] coerceAll(Class<?>[] types, List<Object> args) {
        Object[] out = new Object[types.length];
        for (int i = 0; i < types.length; i++) {
            Object a = args.get(i);
            Class<?> t = types[i];
            if (a == null) {
                if (t.isPrimitive()) return null;
                out[i] = null;
            } else if (t.isInstance(a)) {
                out[i] = a;
            } else if (a instanceof Number n && (t == int.class || t == Integer.class)) {
                out[i] = n.intValue();
            } else if (a instanceof Number n && (t == long.class || t == Long.class)) {
                out[i] = n.longValue();
            } else if (a instanceof Number n && (t == double.class || t == Double.class)) {
                out[i] = n.doubleValue();
            } else if (a instanceof Boolean b && t == boolean.class) {
                out[i] = b;
            } else if (t == String.class) {
                out[i] = TemplateValues.toText(a);
            } else {
                return null;
            }
        }
        return out;
    }

    private static Method findGetter(Class<?> c, String name) {
        // record accessor or fluent getter: street()
        Method m = publicNoArg(c, name);
        if (m != null) return m;
        String cap = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        m = publicNoArg(c, "get" + cap);
        if (m != null) return m;
        return publicNoArg(c, "is" + cap);
    }

    private static Method publicNoArg(Class<?> c, String name) {
        try {
            Method m = c.getMethod(name);
            if (m.getReturnType() == void.class || m.getDeclaringClass() == Object.class) return null;
            return m;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Field findField(Class<?> c, String name) {
        try {
            return c.getField(name);
        } catch (NoSuchFieldException e) {
            return null;
        }
    }

    private static boolean isIndex(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
