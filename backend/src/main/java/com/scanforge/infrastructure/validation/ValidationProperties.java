package com.scanforge.infrastructure.validation;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the generated-code validator, bound from {@code validation.*}.
 */
@Data
@Validated
@ConfigurationProperties("validation")
public class ValidationProperties {

    @Min(40)
    private int maxLineLength = 120;

    /** Modules every generated scanner must import. */
    private List<String> requiredImports = new ArrayList<>(List.of("pandas", "numpy"));

    /** Third-party libraries accepted with a warning. application.yml does not repeat this list. */
    private List<String> recognizedLibraries = new ArrayList<>(List.of(
            "pandas", "numpy", "requests", "pandas_market_calendars", "scipy", "sklearn", "matplotlib",
            "polygon", "yfinance", "talib", "ta", "pytz", "dateutil", "dotenv", "aiohttp", "tqdm", "numba"));

    /** Additional modules treated as always available. */
    private List<String> knownModules = new ArrayList<>();
}
