package config;

import util.JsonSupport;

/**
 * Loads a {@link ScaleConfig} from JSON. Missing fields keep their defaults.
 */
public class ConfigLoader {

    private ConfigLoader() {
    }

    public static ScaleConfig load(String location) {
        if (location == null) {
            return new ScaleConfig();
        }
        return JsonSupport.read(location, ScaleConfig.class);
    }
}
