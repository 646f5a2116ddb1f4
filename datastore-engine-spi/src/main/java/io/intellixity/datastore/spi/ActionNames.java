package io.intellixity.datastore.spi;

/** Action names passed to {@link AccessPolicy#checkAccess}. */
public final class ActionNames {
  public static final String CREATE = "datastore_create";
  public static final String UPSERT = "datastore_upsert";
  public static final String DELETE = "datastore_delete";
  public static final String SEARCH = "datastore_search";
  public static final String SEARCH_SQL = "datastore_search_sql";
  public static final String CHANGE_PERMISSIONS = "datastore_change_permissions";
  public static final String INFO = "datastore_info";

  private ActionNames() {}
}
