package com.hostprobe.core.diagnostics;

import com.hostprobe.core.model.EnvironmentReport;
import com.hostprobe.core.security.MaskedValue;
import com.hostprobe.core.security.SecretMasker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Dumps the process environment with values masked by key name.
 */
@Service
public class EnvironmentInspector {

    static final int MAX_FILTER_LENGTH = 200;

    private final SecretMasker masker;
    private final Supplier<Map<String, String>> environment;

    @Autowired
    public EnvironmentInspector(SecretMasker masker) {
        this(masker, System::getenv);
    }

    EnvironmentInspector(SecretMasker masker, Supplier<Map<String, String>> environment) {
        this.masker = masker;
        this.environment = environment;
    }

    public EnvironmentReport inspect(DiagnosticOperation.InspectEnvironment op) {
        String filter = Params.optionalText("filter", op.filter(), MAX_FILTER_LENGTH);
        String needle = filter == null ? null : filter.toLowerCase(Locale.ROOT);

        Map<String, String> env = environment.get();
        SortedMap<String, String> variables = new TreeMap<>();
        int masked = 0;
        for (var entry : masker.maskAll(env).entrySet()) {
            if (needle != null && !entry.getKey().toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }
            MaskedValue value = entry.getValue();
            variables.put(entry.getKey(), value.value());
            if (value.wasMasked()) {
                masked++;
            }
        }

        String path = env.get("PATH");
        List<String> pathEntries = path == null || masker.isSensitiveKey("PATH")
                ? List.of()
                : Arrays.stream(path.split(File.pathSeparator)).filter(s -> !s.isBlank()).toList();
        return new EnvironmentReport(filter, variables, variables.size(), masked, pathEntries);
    }
}
