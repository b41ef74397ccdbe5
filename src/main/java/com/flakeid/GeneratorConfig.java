package com.flakeid;

/**
 * Configuration of a generator, tagged with the generator type it belongs to.
 *
 * <p>Registries route a config to the factory registered for {@link #type()},
 * so every concrete config reports a fixed type.</p>
 */
public interface GeneratorConfig {

    GeneratorType type();
}
