package io.github.tanejagagan.access.server;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;

/**
 * The application main class.
 */
public class Main {

    public static final String CONFIG_PATH = "access-policy";

    public static class Args {
        @Parameter(names = {"--conf"}, description = "Configurations" )
        private List<String> configs;
    }

    /**
     * Cannot be instantiated.
     */
    private Main() {
    }

    public static Config loadConfig(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .build()
                .parse(args);
        var configMap = new HashMap<String, String>();
        if (argv.configs != null) {
            argv.configs.forEach(c -> {
                var e = c.indexOf("=");
                if (e <= 0) {
                    throw new IllegalArgumentException("Expected key=value but got " + c);
                }
                configMap.put(c.substring(0, e), c.substring(e + 1));
            });
        }
        var commandlineConfig = ConfigFactory.parseMap(configMap);
        return commandlineConfig.withFallback(ConfigFactory.load().getConfig(CONFIG_PATH)).resolve();
    }

    public static PolicyHttpServer start(String[] args) throws IOException {
        var config = loadConfig(args);
        return new PolicyHttpServer(config, new PolicyStore()).start();
    }

    /**
     * Application main entry point.
     * @param args command line arguments.
     */
    public static void main(String[] args) throws IOException {
        start(args);
    }
}
