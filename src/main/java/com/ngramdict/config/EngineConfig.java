package com.ngramdict.config;

import com.ngramdict.dictionary.DictionaryStrategy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或properties文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    public static final String KEY_DICTIONARY = "ngramdict.dictionary";
    public static final String KEY_STRATEGY = "ngramdict.strategy";
    public static final String KEY_MAX_NGRAM_SIZE = "ngramdict.maxNgramSize";

    private Path dictionaryPath = Paths.get(Constants.DEFAULT_DICTIONARY_FILE);
    private DictionaryStrategy strategy = Constants.DEFAULT_STRATEGY;
    private int maxNgramSize = Constants.DEFAULT_MAX_NGRAM_SIZE;

    public Path getDictionaryPath() {
        return dictionaryPath;
    }

    public void setDictionaryPath(Path dictionaryPath) {
        this.dictionaryPath = dictionaryPath;
    }

    public DictionaryStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(DictionaryStrategy strategy) {
        this.strategy = strategy;
    }

    public int getMaxNgramSize() {
        return maxNgramSize;
    }

    public void setMaxNgramSize(int maxNgramSize) {
        this.maxNgramSize = maxNgramSize;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从properties读取配置，缺失的键保留默认值
     *
     * @throws IllegalArgumentException 策略名未知或n-gram大小不是整数时抛出
     */
    public static EngineConfig fromProperties(Properties properties) {
        EngineConfig config = defaults();
        String dictionary = properties.getProperty(KEY_DICTIONARY);
        if (dictionary != null && !dictionary.isBlank()) {
            config.setDictionaryPath(Paths.get(dictionary.trim()));
        }
        String strategyName = properties.getProperty(KEY_STRATEGY);
        if (strategyName != null && !strategyName.isBlank()) {
            config.setStrategy(DictionaryStrategy.fromName(strategyName));
        }
        String maxNgram = properties.getProperty(KEY_MAX_NGRAM_SIZE);
        if (maxNgram != null && !maxNgram.isBlank()) {
            try {
                config.setMaxNgramSize(Integer.parseInt(maxNgram.trim()));
            } catch (NumberFormatException exception) {
                throw new IllegalArgumentException(KEY_MAX_NGRAM_SIZE + " 不是整数: " + maxNgram, exception);
            }
        }
        return config;
    }
}
