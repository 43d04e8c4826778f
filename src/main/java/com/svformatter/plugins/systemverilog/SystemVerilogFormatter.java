package com.svformatter.plugins.systemverilog;

import com.svformatter.api.FormatterPlugin;
import com.svformatter.api.FormatterResult;
import com.svformatter.api.error.FormatException;
import com.svformatter.api.error.FormatterError;
import com.svformatter.api.error.Severity;
import com.svformatter.config.ConfigurationLoader;
import com.svformatter.config.FormatterConfig;
import com.svformatter.plugins.systemverilog.render.ErrorNodePolicy;
import com.svformatter.plugins.systemverilog.render.KindMapping;
import com.svformatter.plugins.systemverilog.render.KindTableGenerator;
import com.svformatter.plugins.systemverilog.render.RenderSettings;
import com.svformatter.plugins.systemverilog.render.SymbolClassifier;
import com.svformatter.plugins.systemverilog.render.TreeFormatter;
import com.svformatter.syntax.GrammarMetadata;
import com.svformatter.syntax.SourceParser;
import com.svformatter.syntax.SyntaxNode;
import com.svformatter.syntax.SyntaxTree;
import com.svformatter.syntax.sv.SvParser;
import com.svformatter.util.LoggerUtil;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * SystemVerilog formatter plugin.
 *
 * <p>On initialization the grammar metadata and the kind mapping are loaded and joined into the
 * classifier table; a mismatch between them fails initialization. Parsed trees are cached per
 * file and content (oldest entry evicted first) so that formatting and dumping the same input
 * parses it once.
 */
public class SystemVerilogFormatter implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(SystemVerilogFormatter.class);

    public static final String GRAMMAR_RESOURCE = "/systemverilog/node-types.yml";
    public static final String KIND_MAPPING_RESOURCE = "/systemverilog/kind-mapping.yml";
    private static final int TREE_CACHE_SIZE = 100;

    private SourceParser parser;
    private TreeFormatter treeFormatter;

    private final Map<String, SyntaxTree> treeCache = new LinkedHashMap<String, SyntaxTree>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, SyntaxTree> eldest) {
            return size() > TREE_CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    @Override
    public void initialize(FormatterConfig config) {
        RenderSettings settings = new RenderSettings(
                config.getIndentSize(),
                config.getLineLength(),
                ErrorNodePolicy.fromConfig(config.getPluginConfig(
                        ConfigurationLoader.PLUGIN_SYSTEMVERILOG, ConfigurationLoader.ERROR_NODES, "abort")));

        GrammarMetadata grammar = GrammarMetadata.load(GRAMMAR_RESOURCE);
        KindMapping mapping = KindMapping.load(KIND_MAPPING_RESOURCE);
        SymbolClassifier classifier = KindTableGenerator.generate(grammar, mapping);

        this.parser = new SvParser(grammar);
        this.treeFormatter = new TreeFormatter(classifier, settings);
        logger.info("SystemVerilog plugin ready: grammar " + grammar.getName() + " v" + grammar.getVersion()
                + ", " + settings);
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        checkInitialized();
        FormatterResult.Builder result = FormatterResult.builder().originalCode(sourceCode);
        try {
            SyntaxTree tree = parse(filePath, sourceCode);
            String formatted = treeFormatter.format(tree);

            // only reachable with errorNodes: verbatim
            for (SyntaxNode error : findErrorNodes(tree.getRoot())) {
                result.addError(new FormatterError(Severity.WARNING,
                        "Syntax error passed through unchanged",
                        error.getStartPoint().getRow() + 1, error.getStartPoint().getColumn() + 1));
            }
            return result.successful(true).formattedCode(formatted).build();
        } catch (FormatException e) {
            logger.fine("Could not format " + filePath + ": " + e.getMessage());
            return result.successful(false).formattedCode(null)
                    .addError(FormatterError.fromException(e))
                    .build();
        }
    }

    @Override
    public String dumpTree(Path filePath, String sourceCode) {
        checkInitialized();
        return treeFormatter.dump(parse(filePath, sourceCode));
    }

    private SyntaxTree parse(Path filePath, String sourceCode) {
        String cacheKey = filePath + ":" + sourceCode.hashCode();

        readLock.lock();
        try {
            SyntaxTree cached = treeCache.get(cacheKey);
            if (cached != null && cached.getSource().equals(sourceCode)) {
                return cached;
            }
        } finally {
            readLock.unlock();
        }

        SyntaxTree tree = parser.parse(sourceCode);

        writeLock.lock();
        try {
            treeCache.put(cacheKey, tree);
        } finally {
            writeLock.unlock();
        }
        return tree;
    }

    private static List<SyntaxNode> findErrorNodes(SyntaxNode root) {
        List<SyntaxNode> errors = new ArrayList<>();
        if (!root.hasError()) {
            return errors;
        }
        Deque<SyntaxNode> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            SyntaxNode node = work.pop();
            if (node.isError()) {
                errors.add(node);
                continue;
            }
            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i).hasError()) {
                    work.push(children.get(i));
                }
            }
        }
        return errors;
    }

    private void checkInitialized() {
        if (treeFormatter == null) {
            throw new IllegalStateException("SystemVerilog plugin used before initialize()");
        }
    }

    int getCachedTreeCount() {
        readLock.lock();
        try {
            return treeCache.size();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            treeCache.clear();
        } finally {
            writeLock.unlock();
        }
    }
}
