package com.litscan.extractor;

import cn.hutool.core.util.StrUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 有序的抽取规则链，第一个命中的规则生效
 *
 * <p>每一步都是 {@code String -> Optional<T>} 的纯函数，可单独测试。</p>
 *
 * @author litscan
 */
@Slf4j
public final class PatternCascade<T> {

    private final String name;
    private final List<Function<String, Optional<T>>> steps;

    private PatternCascade(String name, List<Function<String, Optional<T>>> steps) {
        this.name = name;
        this.steps = steps;
    }

    @SafeVarargs
    public static <T> PatternCascade<T> of(String name, Function<String, Optional<T>>... steps) {
        return new PatternCascade<>(name, List.of(steps));
    }

    public Optional<T> apply(String text) {
        if (StrUtil.isBlank(text)) {
            return Optional.empty();
        }
        for (int i = 0; i < steps.size(); i++) {
            Optional<T> result = steps.get(i).apply(text);
            if (result.isPresent()) {
                log.debug("{} 第{}条规则命中: {}", name, i + 1, result.get());
                return result;
            }
        }
        return Optional.empty();
    }

    public int size() {
        return steps.size();
    }

    public String getName() {
        return name;
    }

    /**
     * 取第一个匹配的第 1 组，经后处理后为空则视为未命中
     */
    public static Function<String, Optional<String>> firstGroup(Pattern pattern, UnaryOperator<String> post) {
        return text -> {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return Optional.empty();
            }
            return Optional.ofNullable(StrUtil.trimToNull(post.apply(matcher.group(1))));
        };
    }

    public static Function<String, Optional<String>> firstGroup(Pattern pattern) {
        return firstGroup(pattern, UnaryOperator.identity());
    }
}
