package com.toolpack.loader;

import com.toolpack.error.ToolLoadException;

/**
 * {@link ModuleLoader} backed by {@link Class#forName(String, boolean, ClassLoader)}; running the
 * class's static initializer is the equivalent of executing the entry module.
 * <p>
 * Any fault raised while initializing the class surfaces as {@link ToolLoadException}, except
 * JVM resource errors other than {@link StackOverflowError}, which are rethrown.
 */
public final class ReflectiveModuleLoader implements ModuleLoader {

    @Override
    public Class<?> loadSymbol(ClassLoader module, String symbolName) {
        try {
            return Class.forName(symbolName, true, module);
        } catch (ClassNotFoundException e) {
            throw new ToolLoadException("symbol not found: " + symbolName, e);
        } catch (ExceptionInInitializerError e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw initializationFailed(symbolName, cause);
        } catch (LinkageError e) {
            throw new ToolLoadException("Failed to link " + symbolName + ": " + e, e);
        } catch (StackOverflowError e) {
            throw initializationFailed(symbolName, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            // Errors thrown by a static initializer are not wrapped by the JVM
            throw initializationFailed(symbolName, e);
        }
    }

    private static ToolLoadException initializationFailed(String symbolName, Throwable cause) {
        return new ToolLoadException("Initialization of " + symbolName + " failed: " + cause, cause);
    }
}
