package generator;

import dao.WriteMode;
import model.Identified;

import java.util.function.Consumer;

/**
 * Produces the entities of a dataset. Parents are emitted before the rows that reference them.
 */
public interface GenerationStrategy {

    String name();

    WriteMode writeMode();

    /**
     * @throws config.ConfigurationException when the inputs of the strategy are unusable
     */
    void generate(GenerationContext context, Consumer<Identified> emit);
}
