package io.github.treetags.profile;

import java.lang.reflect.InvocationTargetException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;

/** Produces the tree-sitter grammar of a profile. */
@FunctionalInterface
public interface GrammarSource {

    TSLanguage load(String language) throws ProfileLoadException;

    /** Wraps a bundled grammar constructor; failures to bind its native library become profile errors. */
    static GrammarSource bundled(Supplier<TSLanguage> constructor) {
        return language -> {
            try {
                return constructor.get();
            } catch (LinkageError | RuntimeException e) {
                throw new ProfileLoadException(language, "grammar failed to load: " + e, e);
            }
        };
    }

    /**
     * Instantiates {@code className}, a {@link TSLanguage} subclass with a public no-argument constructor, found on the
     * application classpath or, when {@code jar} is given, in that jar.
     */
    static GrammarSource fromClass(String className, @Nullable Path jar) {
        return language -> {
            ClassLoader loader = GrammarSource.class.getClassLoader();
            if (jar != null) {
                if (!Files.isRegularFile(jar)) {
                    throw new ProfileLoadException(language, "grammar library not found: " + jar);
                }
                try {
                    // stays open for the life of the process; the grammar's native code is bound to it
                    loader = new URLClassLoader(new URL[] {jar.toUri().toURL()}, loader);
                } catch (MalformedURLException e) {
                    throw new ProfileLoadException(language, "bad grammar library path " + jar, e);
                }
            }
            try {
                Class<?> cls = Class.forName(className, true, loader);
                if (!TSLanguage.class.isAssignableFrom(cls)) {
                    throw new ProfileLoadException(language, className + " is not a tree-sitter language");
                }
                return (TSLanguage) cls.getDeclaredConstructor().newInstance();
            } catch (ClassNotFoundException e) {
                throw new ProfileLoadException(language, "grammar class not found: " + className, e);
            } catch (InvocationTargetException e) {
                throw new ProfileLoadException(language, "grammar failed to initialize: " + e.getCause(), e);
            } catch (ReflectiveOperationException | LinkageError e) {
                throw new ProfileLoadException(language, "grammar failed to load: " + e, e);
            }
        };
    }

    /** Conventional class name of a bonede grammar binding, e.g. {@code org.treesitter.TreeSitterKotlin}. */
    static String defaultClassName(String language) {
        var sb = new StringBuilder("org.treesitter.TreeSitter");
        boolean upper = true;
        for (char c : language.toCharArray()) {
            if (c == '-' || c == '_') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = false;
        }
        return sb.toString();
    }
}
