package eu.fbk.ontomodule.extract;

import eu.fbk.ontomodule.store.MemoryStatementStore;
import eu.fbk.ontomodule.store.StatementStore;

public class MemoryExtractorTest extends AbstractExtractorTest {

    @Override
    protected StatementStore createStore() {
        return new MemoryStatementStore();
    }

}
