package io.paradedb.operator.crd.paradedb.config;

import org.jspecify.annotations.NullMarked;

/**
 * Shell scripts run by the backup CronJob.
 * <p>
 * The scripts are static, everything instance specific is passed as environment variables (see the
 * {@code ENV_*} constants). Dumps are named {@code <prefix>-YYYYMMDD-HHMMSS.dump}, so a reverse
 * lexical sort orders them newest first.
 */
@NullMarked
public final class BackupScriptBuilder {
    public static final String ENV_BACKUP_DIR = "BACKUP_DIR";
    public static final String ENV_BACKUP_PREFIX = "BACKUP_PREFIX";
    public static final String ENV_KEEP_LAST = "KEEP_LAST";
    public static final String ENV_KEEP_DAILY = "KEEP_DAILY";
    public static final String ENV_KEEP_WEEKLY = "KEEP_WEEKLY";
    public static final String ENV_S3_BUCKET = "S3_BUCKET";
    public static final String ENV_S3_PREFIX = "S3_PREFIX";
    public static final String ENV_S3_ENDPOINT = "S3_ENDPOINT";

    /**
     * Matches the part of a dump name after the instance prefix. Anchored on both ends so that the dumps of
     * {@code db} never include those of {@code db-replica}.
     */
    public static final String DUMP_NAME_SUFFIX_REGEX = "-[0-9]{8}-[0-9]{6}\\.dump$";

    private static final String DUMP = """
            mkdir -p "$BACKUP_DIR"
            timestamp=$(date -u +%Y%m%d-%H%M%S)
            file="$BACKUP_DIR/$BACKUP_PREFIX-$timestamp.dump"
            echo "Dumping database $PGDATABASE from $PGHOST to $file"
            pg_dump --host="$PGHOST" --port="$PGPORT" --username="$PGUSER" --dbname="$PGDATABASE" --format=custom --file="$file"
            echo "Backup completed: $file ($(du -h "$file" | cut -f1))"
            """;

    private static final String OWN_DUMPS = "own_dumps() {\n"
            + "  grep -E \"^$BACKUP_PREFIX" + DUMP_NAME_SUFFIX_REGEX + "\" || true\n"
            + "}\n";

    /**
     * Reads dump names on stdin and prints the ones that fall outside the retention policy. A dump is
     * kept if it is one of the newest KEEP_LAST dumps, the newest dump of one of the KEEP_DAILY most
     * recent days, or the newest dump of one of the KEEP_WEEKLY most recent ISO weeks.
     */
    private static final String SELECT_EXPIRED = """
            select_expired() {
              index=0
              days=0
              weeks=0
              kept_days=" "
              kept_weeks=" "
              for name in $(sort -r); do
                stamp=${name%-*}
                stamp=${stamp##*-}
                case "$stamp" in
                  [0-9][0-9][0-9][0-9][0-9][0-9][0-9][0-9]) ;;
                  *) continue ;;
                esac
                keep=0
                index=$((index + 1))
                if [ "$index" -le "$KEEP_LAST" ]; then
                  keep=1
                fi
                case "$kept_days" in
                  *" $stamp "*) ;;
                  *)
                    if [ "$days" -lt "$KEEP_DAILY" ]; then
                      kept_days="$kept_days$stamp "
                      days=$((days + 1))
                      keep=1
                    fi
                    ;;
                esac
                week=$(date -u -d "$stamp" +%G-W%V)
                case "$kept_weeks" in
                  *" $week "*) ;;
                  *)
                    if [ "$weeks" -lt "$KEEP_WEEKLY" ]; then
                      kept_weeks="$kept_weeks$week "
                      weeks=$((weeks + 1))
                      keep=1
                    fi
                    ;;
                esac
                if [ "$keep" -eq 0 ]; then
                  echo "$name"
                fi
              done
            }
            """;

    private static final String PRUNE_VOLUME = """
            ls -1 "$BACKUP_DIR" | own_dumps | select_expired | while read -r expired; do
              echo "Removing expired backup $expired"
              rm -f "$BACKUP_DIR/$expired"
            done
            """;

    private static final String UPLOAD_AND_PRUNE_S3 = """
            endpoint_args=""
            if [ -n "${S3_ENDPOINT:-}" ]; then
              endpoint_args="--endpoint-url $S3_ENDPOINT"
            fi
            uploaded=0
            for file in "$BACKUP_DIR"/*.dump; do
              [ -e "$file" ] || continue
              aws $endpoint_args s3 cp "$file" "s3://$S3_BUCKET/$S3_PREFIX$(basename "$file")"
              uploaded=$((uploaded + 1))
            done
            if [ "$uploaded" -eq 0 ]; then
              echo "No dump found in $BACKUP_DIR"
              exit 1
            fi
            aws $endpoint_args s3 ls "s3://$S3_BUCKET/$S3_PREFIX" | awk '{print $4}' | own_dumps | select_expired | while read -r expired; do
              echo "Removing expired backup $expired"
              aws $endpoint_args s3 rm "s3://$S3_BUCKET/$S3_PREFIX$expired"
            done
            """;

    private static final String HEADER = "set -eu\n";

    /**
     * Dump into the backup volume and prune it in place.
     */
    public static String volumeScript() {
        return HEADER + OWN_DUMPS + SELECT_EXPIRED + DUMP + PRUNE_VOLUME;
    }

    /**
     * Dump into a scratch directory shared with the uploader.
     */
    public static String dumpScript() {
        return HEADER + DUMP;
    }

    public static String s3UploadScript() {
        return HEADER + OWN_DUMPS + SELECT_EXPIRED + UPLOAD_AND_PRUNE_S3;
    }

    /**
     * Normalize a user supplied object key prefix to either empty or {@code segment/.../}.
     */
    public static String s3Prefix(String path) {
        var trimmed = path.strip();

        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }

        return trimmed.isEmpty() ? "" : trimmed + "/";
    }

    /**
     * Object key prefix of one instance: the user supplied path followed by {@code <namespace>/<name>/}, so
     * instances sharing a bucket never see each other's dumps.
     */
    public static String s3InstancePrefix(
            String path,
            String namespace,
            String name
    ) {
        return s3Prefix(path) + namespace + "/" + name + "/";
    }

    private BackupScriptBuilder() {
    }
}
