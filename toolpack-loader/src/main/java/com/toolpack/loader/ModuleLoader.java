package com.toolpack.loader;

import com.toolpack.error.ToolLoadException;

/**
 * Capability to obtain a tool's implementation class by name from a tool module.
 */
public interface ModuleLoader {

    /**
     * Resolves and initializes the class named {@code symbolName} through the module's class loader.
     *
     * @param module     class loader over the tool's entry and search locations
     * @param symbolName binary class name (e.g. {@code Tool} or {@code com.example.weather.WeatherTool})
     * @return the initialized class
     * @throws ToolLoadException if the class does not exist or its initialization fails
     */
    Class<?> loadSymbol(ClassLoader module, String symbolName);
}
