package com.slidebind.template.parser;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.slidebind.debug.Debug;

/**
 * Variables available to every template unless the data binds the same name.
 * Suppliers are read once per environment build.
 */
public final class GlobalVariables {

    private GlobalVariables() {}

    public static Map<String, Supplier<Object>> standard() {
        Map<String, Supplier<Object>> m = new LinkedHashMap<>();
        m.put("Today", LocalDate::now);
        m.put("Now", LocalDateTime::now);
        m.put("Year", () -> LocalDate.now().getYear());
        m.put("Month", () -> LocalDate.now().getMonthValue());
        m.put("Day", () -> LocalDate.now().getDayOfMonth());
        m.put("MachineName", GlobalVariables::machineName);
        m.put("UserName", () -> System.getProperty("user.name", ""));
        m.put("OSVersion", () -> System.getProperty("os.name", "") + " " + System.getProperty("os.version", ""));
        m.put("ProcessorCount", () -> Runtime.getRuntime().availableProcessors());
        return m;
    }

    /** Reads every supplier; a failing supplier binds nothing. */
    public static Map<String, Value> resolve(Map<String, Supplier<Object>> suppliers) {
        Map<String, Value> out = new LinkedHashMap<>();
        if (suppliers == null) return out;
        for (Map.Entry<String, Supplier<Object>> e : suppliers.entrySet()) {
            try {
                out.put(e.getKey(), ValueBinder.bind(e.getValue().get()));
            } catch (RuntimeException ex) {
                Debug.get().w("slidebind.eval", "Global variable '" + e.getKey() + "' failed: " + ex.getMessage(), ex);
            }
        }
        return out;
    }

    private static String machineName() {
        String env = System.getenv("COMPUTERNAME");
        if (env == null) env = System.getenv("HOSTNAME");
        if (env != null) return env;
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
