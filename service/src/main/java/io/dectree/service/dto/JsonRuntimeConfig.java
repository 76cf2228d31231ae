// file: service/src/main/java/io/dectree/service/dto/JsonRuntimeConfig.java
package io.dectree.service.dto;

/**
 * JSON shape of a runtime config file; every field is optional:
 *   {
 *     "indexDir": "./data/index",
 *     "cacheDir": "./data/cache",
 *     "preferencesFile": "/home/me/.dectreerc",
 *     "originalLanguage": "de"
 *   }
 */
public class JsonRuntimeConfig {
    public String indexDir;
    public String cacheDir;
    public String preferencesFile;
    public String originalLanguage;
}
