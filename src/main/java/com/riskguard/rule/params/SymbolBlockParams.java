package com.riskguard.rule.params;

import com.riskguard.domain.enums.RuleKind;
import com.riskguard.rule.RuleSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Blocked symbol patterns. {@code *} matches any run of characters and {@code ?} a single
 * character; matching ignores case.
 */
@Getter
@Builder
@ToString
public class SymbolBlockParams {

    private final List<String> patterns;

    @ToString.Exclude
    private final List<Pattern> compiled;

    public boolean isBlocked(String symbol) {
        if (symbol == null) {
            return false;
        }
        String candidate = symbol.toUpperCase(Locale.ROOT);
        return compiled.stream().anyMatch(pattern -> pattern.matcher(candidate).matches());
    }

    public static SymbolBlockParams from(RuleSpec spec) {
        List<String> patterns = spec.getBlockedSymbols();
        if (patterns == null || patterns.isEmpty()) {
            throw ParamValidation.invalid(RuleKind.SYMBOL_BLOCKS, "blocked-symbols", "must list at least one symbol");
        }
        List<Pattern> compiled = new ArrayList<>();
        for (String raw : patterns) {
            if (raw == null || raw.isBlank()) {
                throw ParamValidation.invalid(RuleKind.SYMBOL_BLOCKS, "blocked-symbols", "contains a blank entry");
            }
            compiled.add(toRegex(raw.trim().toUpperCase(Locale.ROOT)));
        }
        return SymbolBlockParams.builder()
                .patterns(List.copyOf(patterns))
                .compiled(List.copyOf(compiled))
                .build();
    }

    static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
