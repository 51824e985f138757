package io.textjustifier.cli;

import io.textjustifier.justify.BreakStrategy;
import picocli.CommandLine;

public class BreakStrategyConverter implements CommandLine.ITypeConverter<BreakStrategy> {

    @Override
    public BreakStrategy convert(String value) {
        return BreakStrategy.from(value);
    }
}
