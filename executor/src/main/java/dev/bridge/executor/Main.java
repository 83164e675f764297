package dev.bridge.executor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        if (arguments.remove("--help")) {
            printUsage();
            return;
        }
        String host = option(arguments, "--host", "localhost");
        int port = Integer.parseInt(option(arguments, "--port", "8765"));
        String name = option(arguments, "--name", "reference-executor");
        if (!arguments.isEmpty()) {
            System.err.println("Unknown arguments: " + arguments);
            printUsage();
            System.exit(2);
        }

        ExecutorClient client = new ExecutorClient(host, port, name, defaultOperations());
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            client.close();
            shutdown.countDown();
        }, "executor-shutdown"));
        try {
            client.connect();
        } catch (IOException e) {
            LOGGER.error("Unable to connect to {}:{}: {}", host, port, e.getMessage());
            System.exit(1);
        }
        shutdown.await();
    }

    static OperationRegistry defaultOperations() {
        return new OperationRegistry()
            .register("ping", payload -> "pong")
            .register("echo", payload -> new LinkedHashMap<>(payload))
            .register("sleep", Main::sleep);
    }

    private static Object sleep(Map<String, Object> payload) throws InterruptedException {
        if (!(payload.get("millis") instanceof Number millis)) {
            throw new IllegalArgumentException("millis is required and must be a number");
        }
        if (millis.longValue() < 0) {
            throw new IllegalArgumentException("millis must not be negative");
        }
        Thread.sleep(millis.longValue());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("slept", millis.longValue());
        return result;
    }

    private static String option(List<String> arguments, String name, String defaultValue) {
        int index = arguments.indexOf(name);
        if (index < 0) {
            return defaultValue;
        }
        if (index + 1 >= arguments.size()) {
            throw new IllegalArgumentException(name + " requires a value");
        }
        String value = arguments.get(index + 1);
        arguments.subList(index, index + 2).clear();
        return value;
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar executor.jar [--host <host>] [--port <port>] [--name <name>]\n" +
            "Operations:\n" +
            "  ping            replies \"pong\"\n" +
            "  echo            replies with its parameters\n" +
            "  sleep millis=N  waits N milliseconds");
    }
}
