package dev.codesearch.index;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.IOUtils;
import org.jspecify.annotations.Nullable;

/** An open Lucene index, queried through a {@link SearcherManager} refreshed after each write. */
final class LuceneIndexHandle implements IndexHandle {

  static final String FIELD_PATH = "path";
  static final String FIELD_CONTENT = "content";
  static final String FIELD_FILENAME = "filename";
  static final String FIELD_EXTENSION = "extension";
  static final String FIELD_DIRECTORY = "directory";
  static final String FIELD_SIZE = "size";
  static final String FIELD_MODIFIED = "modified";
  static final String FIELD_FILENAME_LOWER = "filename_lower";
  static final String FIELD_PATH_LOWER = "path_lower";

  private static final List<String> METADATA_FIELDS =
      List.of(FIELD_FILENAME, FIELD_EXTENSION, FIELD_DIRECTORY, FIELD_SIZE, FIELD_MODIFIED);

  /** Longest excerpt returned per hit; the response mode decides how much of it is shown. */
  static final int EXCERPT_CHARS = 2000;
  private static final int SNIPPET_LEAD_CHARS = 80;

  private final Path workspaceRoot;
  private final Directory directory;
  private final Analyzer analyzer;
  private final IndexWriter writer;
  private final SearcherManager searcherManager;

  LuceneIndexHandle(
      Path workspaceRoot,
      Directory directory,
      Analyzer analyzer,
      IndexWriter writer,
      SearcherManager searcherManager) {
    this.workspaceRoot = workspaceRoot;
    this.directory = directory;
    this.analyzer = analyzer;
    this.writer = writer;
    this.searcherManager = searcherManager;
  }

  @Override
  public Path workspaceRoot() {
    return workspaceRoot;
  }

  @Override
  public List<RawResult> query(String query, int maxResults) {
    if (query.isBlank() || maxResults < 1) {
      return List.of();
    }
    return search(parse(query), maxResults, query);
  }

  @Override
  public List<RawResult> findFiles(String pattern, int maxResults) {
    String normalized = pattern.strip().replace('\\', '/').toLowerCase(Locale.ROOT);
    if (normalized.isEmpty() || maxResults < 1) {
      return List.of();
    }
    if (normalized.indexOf('*') < 0 && normalized.indexOf('?') < 0) {
      normalized = "*" + normalized + "*";
    }
    String field = normalized.indexOf('/') >= 0 ? FIELD_PATH_LOWER : FIELD_FILENAME_LOWER;
    return search(new WildcardQuery(new Term(field, normalized)), maxResults, null);
  }

  private List<RawResult> search(Query query, int maxResults, @Nullable String snippetQuery) {
    try {
      IndexSearcher searcher = searcherManager.acquire();
      try {
        TopDocs topDocs = searcher.search(query, maxResults);
        StoredFields storedFields = searcher.storedFields();
        List<RawResult> results = new ArrayList<>(topDocs.scoreDocs.length);
        for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
          results.add(
              toResult(storedFields.document(scoreDoc.doc), scoreDoc.score, snippetQuery));
        }
        return results;
      } finally {
        searcherManager.release(searcher);
      }
    } catch (IOException e) {
      throw new IndexAccessException("Failed to query index of " + workspaceRoot, e);
    }
  }

  @Override
  public void replaceDocuments(List<IndexedDocument> documents) {
    try {
      writer.deleteAll();
      for (IndexedDocument document : documents) {
        writer.addDocument(toDocument(document));
      }
      writer.commit();
      searcherManager.maybeRefreshBlocking();
    } catch (IOException e) {
      throw new IndexAccessException("Failed to write index of " + workspaceRoot, e);
    }
  }

  @Override
  public long generation() {
    try {
      IndexSearcher searcher = searcherManager.acquire();
      try {
        return ((DirectoryReader) searcher.getIndexReader()).getVersion();
      } finally {
        searcherManager.release(searcher);
      }
    } catch (IOException e) {
      throw new IndexAccessException("Failed to read generation of " + workspaceRoot, e);
    }
  }

  @Override
  public int documentCount() {
    try {
      IndexSearcher searcher = searcherManager.acquire();
      try {
        return searcher.getIndexReader().numDocs();
      } finally {
        searcherManager.release(searcher);
      }
    } catch (IOException e) {
      throw new IndexAccessException("Failed to count documents of " + workspaceRoot, e);
    }
  }

  @Override
  public void close() throws IOException {
    // IndexWriter commits on close
    IOUtils.close(searcherManager, writer, directory, analyzer);
  }

  private Query parse(String query) {
    QueryParser parser = new QueryParser(FIELD_CONTENT, analyzer);
    parser.setAllowLeadingWildcard(true);
    try {
      return parser.parse(query);
    } catch (ParseException e) {
      try {
        return parser.parse(QueryParser.escape(query));
      } catch (ParseException escaped) {
        throw new IllegalArgumentException("Unsupported query: " + query, escaped);
      }
    }
  }

  private static Document toDocument(IndexedDocument source) {
    RawResult location = new RawResult(source.path(), 0);
    Document doc = new Document();
    doc.add(new StringField(FIELD_PATH, source.path(), Field.Store.YES));
    doc.add(new TextField(FIELD_CONTENT, source.content(), Field.Store.YES));
    doc.add(new StringField(FIELD_FILENAME, fileName(source.path()), Field.Store.YES));
    doc.add(
        new StringField(
            FIELD_FILENAME_LOWER,
            fileName(source.path()).toLowerCase(Locale.ROOT),
            Field.Store.NO));
    doc.add(
        new StringField(
            FIELD_PATH_LOWER, source.path().toLowerCase(Locale.ROOT), Field.Store.NO));
    String extension = location.extension();
    if (extension != null) {
      doc.add(new StringField(FIELD_EXTENSION, extension, Field.Store.YES));
    }
    doc.add(new StringField(FIELD_DIRECTORY, location.directory(), Field.Store.YES));
    doc.add(new StoredField(FIELD_SIZE, Long.toString(source.size())));
    doc.add(new StoredField(FIELD_MODIFIED, source.modified().toString()));
    return doc;
  }

  private static RawResult toResult(Document doc, float score, @Nullable String query) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (String name : METADATA_FIELDS) {
      String value = doc.get(name);
      if (value != null) {
        fields.put(name, value);
      }
    }
    String content = doc.get(FIELD_CONTENT);
    return new RawResult(
        doc.get(FIELD_PATH),
        score,
        fields,
        content == null || query == null ? null : snippet(content, query));
  }

  private static String fileName(String path) {
    return path.substring(path.lastIndexOf('/') + 1);
  }

  /**
   * Excerpt of {@code content} starting on the line of the first query term occurrence, or the
   * head of the content when no term occurs literally.
   */
  static String snippet(String content, String query) {
    String lower = content.toLowerCase(Locale.ROOT);
    int hit = -1;
    for (String term : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+")) {
      if (term.isEmpty() || isOperator(term)) {
        continue;
      }
      int index = lower.indexOf(term);
      if (index >= 0 && (hit < 0 || index < hit)) {
        hit = index;
      }
    }
    int start = 0;
    if (hit > 0 && hit < content.length()) {
      int lineStart = content.lastIndexOf('\n', hit - 1) + 1;
      start = Math.max(lineStart, hit - SNIPPET_LEAD_CHARS);
    }
    int end = Math.min(content.length(), start + EXCERPT_CHARS);
    return content.substring(start, end).strip();
  }

  private static boolean isOperator(String term) {
    return term.equals("and") || term.equals("or") || term.equals("not");
  }
}
