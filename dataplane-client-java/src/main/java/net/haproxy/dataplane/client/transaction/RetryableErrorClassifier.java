package net.haproxy.dataplane.client.transaction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import net.haproxy.dataplane.abstractions.exceptions.BundleOperationException;
import net.haproxy.dataplane.abstractions.exceptions.HttpOperationException;
import net.haproxy.dataplane.abstractions.exceptions.OperationCancelledException;
import net.haproxy.dataplane.abstractions.exceptions.RetriesExhaustedException;
import net.haproxy.dataplane.abstractions.exceptions.ServerClientException;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.exception.ExceptionUtils;
import org.apache.http.HttpStatus;

import com.google.common.collect.ImmutableList;

/**
 * Decides whether a failed transactional operation is worth another attempt.
 * Every place that needs this decision goes through this class.
 */
public class RetryableErrorClassifier {

  private final List<ErrorRule> rules;

  public RetryableErrorClassifier() {
    this(Arrays.asList(ErrorRule.values()));
  }

  public RetryableErrorClassifier(List<ErrorRule> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  public List<ErrorRule> getRules() {
    return rules;
  }

  /**
   * @return the first rule matching the error, null when the error is fatal
   */
  public ErrorRule findMatchingRule(Throwable error) {
    if (error == null || isCancellation(error)) {
      return null;
    }
    for (String text : describe(error)) {
      for (ErrorRule rule : rules) {
        if (rule.matches(text)) {
          return rule;
        }
      }
    }
    return null;
  }

  public boolean isRetryable(Throwable error) {
    return findMatchingRule(error) != null;
  }

  /**
   * True when the error says the addressed object is already gone.
   */
  public boolean isMissingObject(Throwable error) {
    if (error == null) {
      return false;
    }
    List<String> texts = describe(error);
    for (String text : texts) {
      // a dead transaction is not a missing object, whatever the status code
      if (text.contains("transaction does not exist")) {
        return false;
      }
    }
    for (Throwable t : ExceptionUtils.getThrowables(error)) {
      if (t instanceof HttpOperationException && ((HttpOperationException) t).getStatusCode() == HttpStatus.SC_NOT_FOUND) {
        return true;
      }
    }
    for (String text : texts) {
      if (text.contains("missing object") || text.contains("does not exist") || text.contains("not found")) {
        return true;
      }
    }
    return false;
  }

  public static boolean isCancellation(Throwable error) {
    return ExceptionUtils.indexOfType(error, OperationCancelledException.class) >= 0
      || ExceptionUtils.indexOfType(error, InterruptedException.class) >= 0;
  }

  /**
   * Lower cased texts the server produced for the error and its causes. Messages the client builds
   * around them carry request paths and entity names, so they are left out.
   */
  private static List<String> describe(Throwable error) {
    List<String> texts = new ArrayList<>();
    for (Throwable t : ExceptionUtils.getThrowables(error)) {
      if (t instanceof HttpOperationException) {
        HttpOperationException httpError = (HttpOperationException) t;
        if (httpError.getApiError() != null && httpError.getApiError().getMessage() != null) {
          texts.add(httpError.getApiError().getMessage().toLowerCase());
        }
        if (StringUtils.isNotBlank(httpError.getResponseBody())) {
          texts.add(httpError.getResponseBody().toLowerCase());
        }
        continue;
      }
      if (isClientWrapper(t)) {
        continue;
      }
      if (t.getMessage() != null) {
        texts.add(t.getMessage().toLowerCase());
      }
    }
    return texts;
  }

  private static boolean isClientWrapper(Throwable t) {
    return t instanceof BundleOperationException || t instanceof RetriesExhaustedException
      || (t instanceof ServerClientException && t.getCause() != null);
  }
}
