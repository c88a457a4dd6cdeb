package ai.wordle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the candidate filter.
 *
 * Every property has a short alias defined in {@code application.properties}, so both forms
 * work on the command line:
 * {@code java -jar wordle-filter-engine.jar --filter.sort=true irate xx..o}
 * {@code java -jar wordle-filter-engine.jar --sort=true --limit=10 irate xx..o}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "filter")
public class FilterProperties {
  private int min = 5;
  private int max = 5;
  /** Maximum number of words to print; zero means unlimited. */
  private int limit = 0;
  private boolean sort = false;
  private String dictionary = "/usr/share/dict/words";

  public int getMin() {
    return min;
  }

  public void setMin(int min) {
    this.min = min;
  }

  public int getMax() {
    return max;
  }

  public void setMax(int max) {
    this.max = max;
  }

  public int getLimit() {
    return limit;
  }

  public void setLimit(int limit) {
    this.limit = limit;
  }

  /**
   * Returns whether surviving candidates are ranked before printing.
   * @return true to rank by letter frequency, false to keep dictionary order
   */
  public boolean isSort() {
    return sort;
  }

  public void setSort(boolean sort) {
    this.sort = sort;
  }

  public String getDictionary() {
    return dictionary;
  }

  public void setDictionary(String dictionary) {
    this.dictionary = dictionary;
  }

  /**
   * Checks the length window, limit and dictionary setting.
   * @throws IllegalArgumentException if min is below 1, max is below min, limit is negative,
   *         or no dictionary is set
   */
  public void validate() {
    if (min < 1) {
      throw new IllegalArgumentException("filter.min must be at least 1, was " + min);
    }
    if (max < min) {
      throw new IllegalArgumentException("filter.max (" + max + ") must not be smaller than filter.min (" + min + ")");
    }
    if (limit < 0) {
      throw new IllegalArgumentException("filter.limit must not be negative, was " + limit);
    }
    if (dictionary == null || dictionary.isBlank()) {
      throw new IllegalArgumentException("filter.dictionary must be set");
    }
  }
}
