package com.loggy.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loggy.sdk.model.LogEvent;

import java.io.PrintStream;

/**
 * Prints each event as one JSON line.
 */
public class JsonConsoleSink implements ConsoleSink {

    private final PrintStream out;
    private final ObjectMapper objectMapper;

    public JsonConsoleSink(PrintStream out, ObjectMapper objectMapper) {
        this.out = out;
        this.objectMapper = objectMapper;
    }

    @Override
    public void print(LogEvent event) {
        String line;
        try {
            line = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            line = event.toString();
        }
        out.println(line);
    }
}
