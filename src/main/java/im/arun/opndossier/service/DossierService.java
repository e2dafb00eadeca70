package im.arun.opndossier.service;

import im.arun.opndossier.config.ConfigLoader;
import im.arun.opndossier.config.WalkerConfig;
import im.arun.opndossier.model.DocumentNode;
import im.arun.opndossier.opnsense.Opnsense;
import im.arun.opndossier.tree.DocumentWalker;
import im.arun.opndossier.tree.ValueClassifier;
import im.arun.opndossier.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for turning a parsed OPNsense configuration into a document
 * tree for the report renderers.
 */
public class DossierService {
    private static final Logger logger = LoggerFactory.getLogger(DossierService.class);

    private final WalkerConfig config;
    private final DocumentWalker walker;

    public DossierService() {
        this(new ConfigLoader().load());
    }

    public DossierService(WalkerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.walker = new DocumentWalker(new ValueClassifier(config), config);
    }

    /**
     * Build the full document tree for a configuration.
     */
    public DocumentNode buildDocument(Opnsense opnsense) {
        Objects.requireNonNull(opnsense, "opnsense");

        logger.info("Building document tree (max depth {})", walker.getMaxDepth());
        DocumentNode root = walker.walk(opnsense);

        if (logger.isDebugEnabled()) {
            logger.debug("Document tree complete: {} nodes, deepest level {}",
                TreeUtils.countNodes(root), TreeUtils.maxLevel(root));
        }
        return root;
    }

    public WalkerConfig getConfig() {
        return config;
    }
}
