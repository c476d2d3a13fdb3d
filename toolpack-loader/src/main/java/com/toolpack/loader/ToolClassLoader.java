package com.toolpack.loader;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Per-load class loader for one tool. Child-first: classes are looked up in the tool's entry and
 * search locations before the host, so each load gets its own namespace and two versions of the
 * same tool do not collide. Host packages are always delegated to the parent so tool classes and
 * the host share one copy of the JDK, logging and host API types.
 * <p>
 * <b>Always shared:</b> {@code java.*}, {@code javax.*}, {@code jdk.*}, {@code sun.*},
 * {@code com.sun.*}, {@code org.slf4j.*}, plus any host API prefixes given to the constructor.
 * Classes not found in the tool fall back to the parent.
 */
public final class ToolClassLoader extends URLClassLoader {

    static {
        ClassLoader.registerAsParallelCapable();
    }

    private static final List<String> HOST_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.slf4j.");

    private final List<String> sharedPrefixes;

    /**
     * @param moduleName     unique module name (also the loader name in stack traces)
     * @param urls           entry first, then search locations
     * @param parent         host class loader
     * @param hostApiPackages additional package prefixes (e.g. {@code com.example.host.}) always loaded from the parent
     */
    public ToolClassLoader(String moduleName, URL[] urls, ClassLoader parent, Collection<String> hostApiPackages) {
        super(moduleName, urls, parent);
        List<String> prefixes = new ArrayList<>(HOST_PACKAGES);
        if (hostApiPackages != null) {
            prefixes.addAll(hostApiPackages);
        }
        this.sharedPrefixes = List.copyOf(prefixes);
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (isShared(name)) {
                    c = super.loadClass(name, false);
                } else {
                    try {
                        c = findClass(name);
                    } catch (ClassNotFoundException e) {
                        c = super.loadClass(name, false);
                    }
                }
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        URL url = findResource(name);
        return url != null ? url : super.getResource(name);
    }

    /** Tool resources first, then the parent's, without duplicates. */
    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        List<URL> urls = new ArrayList<>(Collections.list(findResources(name)));
        ClassLoader parent = getParent();
        if (parent != null) {
            for (URL url : Collections.list(parent.getResources(name))) {
                if (!urls.contains(url)) {
                    urls.add(url);
                }
            }
        }
        return Collections.enumeration(urls);
    }

    boolean isShared(String className) {
        for (String prefix : sharedPrefixes) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
