package dev.codesearch.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IndexCapability} backed by one Lucene {@link FSDirectory} per workspace, located at
 * {@code <indexRoot>/<workspaceKey>}.
 *
 * <p>Opening is the expensive step: it opens the directory, acquires the write lock on it and
 * loads the latest commit. A fresh index is committed immediately so that it has a generation.
 */
public class LuceneIndexCapability implements IndexCapability {

  private static final Logger log = LoggerFactory.getLogger(LuceneIndexCapability.class);

  private final Path indexRoot;

  public LuceneIndexCapability(Path indexRoot) {
    this.indexRoot = indexRoot;
  }

  @Override
  public IndexHandle openOrCreate(Path workspaceRoot, String workspaceKey) throws IOException {
    Path indexPath = indexRoot.resolve(workspaceKey);
    Files.createDirectories(indexPath);

    Directory directory = FSDirectory.open(indexPath);
    Analyzer analyzer = new StandardAnalyzer();
    IndexWriter writer = null;
    try {
      IndexWriterConfig config = new IndexWriterConfig(analyzer);
      config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
      writer = new IndexWriter(directory, config);
      writer.commit();
      SearcherManager searcherManager = new SearcherManager(writer, null);
      log.info("Opened index {} for workspace {}", indexPath, workspaceRoot);
      return new LuceneIndexHandle(workspaceRoot, directory, analyzer, writer, searcherManager);
    } catch (IOException | RuntimeException e) {
      IOUtils.closeWhileHandlingException(writer, directory, analyzer);
      throw e;
    }
  }

  Path indexRoot() {
    return indexRoot;
  }
}
