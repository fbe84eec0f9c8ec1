package com.ffibind.generator.checks;

import java.util.Optional;

import com.ffibind.generator.model.ffi.FfiItem;
import com.ffibind.generator.model.target.Environment;

/**
 * Compiles and runs one FFI wrapper in one environment. Implemented by the build layer.
 */
@FunctionalInterface
public interface WrapperCheck {

    /**
     * @return empty if the wrapper works in {@code environment}, otherwise the failure output
     * @throws Exception if the check could not be carried out; recorded as a failure
     */
    Optional<String> run(FfiItem item, Environment environment) throws Exception;
}
