package com.loggy.sdk.bridge;

import com.loggy.sdk.client.LogFields;
import com.loggy.sdk.client.LogInput;
import com.loggy.sdk.client.Loggy;
import com.loggy.sdk.model.LogEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forwards process-level events from a {@link GlobalEventSource} into a logger.
 *
 * <ul>
 *   <li>uncaught exception: logged as an error at {@code fatal}, immediate</li>
 *   <li>unhandled rejection: reason logged at {@code error}, immediate</li>
 *   <li>warning: logged at {@code warn}</li>
 *   <li>exit: {@code "Application stops with exit code N"} at {@code info}, immediate</li>
 * </ul>
 */
public final class GlobalEventBridge {

    private GlobalEventBridge() {
    }

    public static void register(Loggy loggy, GlobalEventSource source, GlobalEventOptions options) {
        GlobalEventOptions.Toggle exceptions = options.getExceptions();
        if (exceptions.isEnabled()) {
            source.onUncaughtException(error -> loggy.log(
                    LogInput.error(error), fields("fatal", exceptions), true));
        }

        GlobalEventOptions.Toggle rejections = options.getRejections();
        if (rejections.isEnabled()) {
            source.onUnhandledRejection(reason -> loggy.log(
                    LogInput.of(reason), fields("error", rejections), true));
        }

        GlobalEventOptions.Toggle warnings = options.getWarnings();
        if (warnings.isEnabled()) {
            source.onWarning(warning -> loggy.log(
                    LogInput.of(warning), fields("warn", warnings), null));
        }

        GlobalEventOptions.Toggle exits = options.getExits();
        if (exits.isEnabled()) {
            source.onExit(code -> {
                Map<String, Object> exitFields = new LinkedHashMap<>();
                exitFields.put(LogEvent.LEVEL, "info");
                exitFields.put("code", code);
                exitFields.putAll(exits.getExtraFields());
                loggy.log(LogInput.text("Application stops with exit code " + code),
                        LogFields.map(exitFields), true);
            });
        }
    }

    private static LogFields fields(String level, GlobalEventOptions.Toggle toggle) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put(LogEvent.LEVEL, level);
        merged.putAll(toggle.getExtraFields());
        return LogFields.map(merged);
    }
}
