package com.scanforge.infrastructure.rendering;

/**
 * Python text of the generated five-stage scanner. One module template, with the per-ticker method and the
 * aggregation step chosen by the render plan.
 */
final class SkeletonTemplates {

    static final String FRAGMENT = "detection_fragment";
    static final String PRELUDE = "prelude";

    static final String MODULE = """
            {{header}}
            {{prelude}}


            class {{class_name}}:
                \"""
                {{class_doc}}

                Stages: fetch_grouped_data -> apply_smart_filters -> compute_full_features -> detect_patterns
                -> format_results. Rows outside the output window are kept for lookback features.
                \"""

                PATTERN_NAMES = {{pattern_names}}
                FEATURE_FUNCTIONS = {{feature_functions}}
                DEFAULT_PARAMS = {{default_params}}
                SMART_FILTERS = {{smart_filters}}

                def __init__(self, api_key=None, d0_start="{{window_start}}", d0_end="{{window_end}}", params=None):
                    \"""Configure the output window, historical range, worker pools and parameters.\"""
                    self.api_key = api_key or os.environ.get("POLYGON_API_KEY", "")
                    self.base_url = "https://api.polygon.io"
                    self.params = dict(params) if params is not None else self._default_params()
                    self.d0_start_user = d0_start
                    self.d0_end_user = d0_end
                    lookback_days = self.params.get("abs_lookback_days") or {{lookback_days}}
                    lookback_total = int(lookback_days) + {{lookback_buffer}}
                    scan_start_dt = pd.to_datetime(d0_start) - pd.Timedelta(days=lookback_total)
                    self.scan_start = scan_start_dt.strftime("%Y-%m-%d")
                    self.d0_end = d0_end
                    self.stage1_workers = {{fetch_workers}}
                    self.stage3_workers = {{detect_workers}}
                    self.smart_filters = dict(self.SMART_FILTERS)

                def _default_params(self):
                    \"""Extracted defaults overlaid with the preserved configuration literal.\"""
                    merged = dict(self.DEFAULT_PARAMS)
                    merged.update({{source_params}})
                    return merged

                def run_scan(self):
                    \"""Run all stages in order and return the formatted results.\"""
                    raw = self.fetch_grouped_data()
                    if raw.empty:
                        return pd.DataFrame()
                    simple = self.compute_simple_features(raw)
                    filtered = self.apply_smart_filters(simple)
                    if filtered.empty:
                        return pd.DataFrame()
                    features = self.compute_full_features(filtered)
                    detections = self.detect_patterns(features)
                    return self.format_results(detections)

                def fetch_grouped_data(self):
                    \"""Stage 1: grouped daily bars for every trading day of the historical range.\"""
                    nyse = mcal.get_calendar("NYSE")
                    schedule = nyse.schedule(start_date=self.scan_start, end_date=self.d0_end)
                    trading_dates = schedule.index.strftime("%Y-%m-%d").tolist()
                    frames = []
                    with ThreadPoolExecutor(max_workers=self.stage1_workers) as executor:
                        futures = {executor.submit(self._fetch_grouped_day, day): day for day in trading_dates}
                        for future in as_completed(futures):
                            day = futures[future]
                            try:
                                frame = future.result()
                            except Exception as exc:
                                print(f"Failed to fetch {day}: {exc}")
                                continue
                            if frame is not None and not frame.empty:
                                frames.append(frame)
                    if not frames:
                        return pd.DataFrame()
                    return pd.concat(frames, ignore_index=True)

                def _fetch_grouped_day(self, date_str):
                    \"""All tickers for one trading day, or None when the day has no data.\"""
                    url = f"{self.base_url}/v2/aggs/grouped/locale/us/market/stocks/{date_str}"
                    response = requests.get(url, params={"apiKey": self.api_key, "adjusted": "true"}, timeout=30)
                    if response.status_code != 200:
                        return None
                    results = response.json().get("results") or []
                    if not results:
                        return None
                    df = pd.DataFrame(results).rename(columns={
                        "T": "ticker", "o": "open", "h": "high", "l": "low",
                        "c": "close", "v": "volume", "t": "timestamp",
                    })
                    df["date"] = pd.to_datetime(df["timestamp"], unit="ms").dt.strftime("%Y-%m-%d")
                    df = df.dropna(subset=["close", "volume"])
                    return df[["ticker", "date", "open", "high", "low", "close", "volume"]]

                def compute_simple_features(self, df):
                    \"""Cheap per-ticker columns used by the smart filters.\"""
                    if df.empty:
                        return df
                    df = df.sort_values(["ticker", "date"]).reset_index(drop=True)
                    df["date"] = pd.to_datetime(df["date"])
                    df["prev_close"] = df.groupby("ticker")["close"].shift(1)
                    df["prev_volume"] = df.groupby("ticker")["volume"].shift(1)
                    return df

                def apply_smart_filters(self, df):
                    \"""
                    Stage 2: filter rows inside the output window only.

                    Historical rows are returned untouched; lookback features are computed from them.
                    \"""
                    if df.empty:
                        return df
                    d0_start_dt = pd.to_datetime(self.d0_start_user)
                    d0_end_dt = pd.to_datetime(self.d0_end_user)
                    in_window = pd.to_datetime(df["date"]).between(d0_start_dt, d0_end_dt)
                    df_historical = df[~in_window]
                    df_output_range = df[in_window]
                    limits = self.smart_filters
                    df_output_filtered = df_output_range[
                        (df_output_range["prev_close"] >= limits["min_prev_close"])
                        & (df_output_range["prev_close"] <= limits["max_prev_close"])
                        & (df_output_range["prev_volume"] >= limits["min_prev_volume"])
                        & (df_output_range["prev_volume"] <= limits["max_prev_volume"])
                    ]
                    return pd.concat([df_historical, df_output_filtered], ignore_index=True)

                def compute_full_features(self, df):
                    \"""Stage 3: per-ticker features; a failing ticker is skipped.\"""
                    if df.empty:
                        return df
                    df = df.sort_values(["ticker", "date"]).reset_index(drop=True)
                    frames = []
                    for ticker, group in df.groupby("ticker"):
                        try:
                            frames.append(self._compute_ticker_features(group.copy()))
                        except Exception as exc:
                            print(f"Feature computation failed for {ticker}: {exc}")
                    if not frames:
                        return pd.DataFrame()
                    return pd.concat(frames, ignore_index=True)

                def _compute_ticker_features(self, group):
                    \"""Base columns, then the preserved feature functions, then lowercase unique column names.\"""
                    group = group.sort_values("date").reset_index(drop=True)
                    group["prev_high"] = group["high"].shift(1)
                    group["prev_low"] = group["low"].shift(1)
                    group["gap"] = group["open"] - group["prev_close"]
                    group["range"] = group["high"] - group["low"]
                    for column in ("open", "high", "low", "close", "volume", "date"):
                        group[column.capitalize()] = group[column]
                    for feature in self.FEATURE_FUNCTIONS:
                        result = feature(group)
                        if isinstance(result, pd.DataFrame):
                            group = result
                    if "date" not in [str(c).lower() for c in group.columns]:
                        group = group.reset_index()
                    group.columns = [str(c).lower() for c in group.columns]
                    group = group.loc[:, ~group.columns.duplicated()].copy()
                    group["date"] = pd.to_datetime(group["date"])
                    return group

                def detect_patterns(self, df):
                    \"""Stage 4: one task per ticker over pre-sliced frames in a bounded pool.\"""
                    if df.empty:
                        return pd.DataFrame()
                    d0_start_dt = pd.to_datetime(self.d0_start_user)
                    d0_end_dt = pd.to_datetime(self.d0_end_user)
                    in_window = df["date"].between(d0_start_dt, d0_end_dt)
                    active = set(df.loc[in_window, "ticker"].unique())
                    tasks = [
                        (ticker, group.sort_values("date").reset_index(drop=True), d0_start_dt, d0_end_dt)
                        for ticker, group in df.groupby("ticker")
                        if ticker in active
                    ]
                    all_results = []
                    with ThreadPoolExecutor(max_workers=self.stage3_workers) as executor:
                        futures = {executor.submit(self._process_ticker, task): task[0] for task in tasks}
                        for future in as_completed(futures):
                            ticker = futures[future]
                            try:
                                all_results.extend(future.result())
                            except Exception as exc:
                                print(f"Detection failed for {ticker}: {exc}")
            {{aggregation}}
            {{process_ticker}}
                def format_results(self, results):
                    \"""Stage 5: normalize key columns and sort by date and ticker.\"""
                    df = results if isinstance(results, pd.DataFrame) else pd.DataFrame(results)
                    if df.empty:
                        return df
                    key_columns = {c: str(c).lower() for c in df.columns if str(c).lower() in ("ticker", "date")}
                    df = df.rename(columns=key_columns)
                    df = df.loc[:, ~df.columns.duplicated()]
                    sort_columns = [c for c in ("date", "ticker") if c in df.columns]
                    if sort_columns:
                        df = df.sort_values(sort_columns).reset_index(drop=True)
                    return df
            {{stub_methods}}

            def run_scan(d0_start="{{window_start}}", d0_end="{{window_end}}", api_key=None, params=None):
                \"""Run {{class_name}} over the given output window.\"""
                scanner = {{class_name}}(api_key=api_key, d0_start=d0_start, d0_end=d0_end, params=params)
                return scanner.run_scan()


            def main():
                \"""Command-line entry point.\"""
                results = run_scan()
                print(f"{len(results)} signals")
                if not results.empty:
                    print(results.to_string(index=False))


            if __name__ == "__main__":
                main()
            """;

    static final String AGGREGATE_ROWS = """
                    return pd.DataFrame(all_results)
            """;

    static final String AGGREGATE_LABELS = """
                    if not all_results:
                        return pd.DataFrame(columns=["ticker", "date", "scanner_label"])
                    hits = pd.DataFrame(all_results)
                    return (
                        hits.groupby(["ticker", "date"])["scanner_label"]
                        .agg(lambda labels: ", ".join(sorted(set(labels))))
                        .reset_index()
                    )
            """;

    static final String PROCESS_ROWS = """
                def _process_ticker(self, task):
                    \"""Walk one ticker's rows inside the output window; the frame belongs to this task only.\"""
                    ticker, ticker_df, d0_start_dt, d0_end_dt = task
                    P_local = self.params
                    all_rows = []
                    for i in range(2, len(ticker_df)):
                        d0 = ticker_df.iloc[i]["date"]
                        if d0 < d0_start_dt or d0 > d0_end_dt:
                            continue
                        r0 = ticker_df.iloc[i]
                        r1 = ticker_df.iloc[i - 1]
                        r2 = ticker_df.iloc[i - 2]
                        {{detection_fragment}}
                    return all_rows
            """;

    static final String PROCESS_FRAME = """
                def _process_ticker(self, task):
                    \"""Run the preserved detector on one ticker's frame.\"""
                    ticker, ticker_df, d0_start_dt, d0_end_dt = task
                    P_local = self.params
                    all_rows = []
                    {{detection_fragment}}
                    return all_rows
            """;

    static final String PROCESS_RULES = """
                def _process_ticker(self, task):
                    \"""Evaluate every pattern rule on one ticker and emit a labelled row per in-window hit.\"""
                    ticker, ticker_df, d0_start_dt, d0_end_dt = task
                    P_local = self.params
                    df = ticker_df.copy()
                    {{detection_fragment}}
                    all_rows = []
                    window = df[df["date"].between(d0_start_dt, d0_end_dt)]
                    for name in self.PATTERN_NAMES:
                        if name not in window.columns:
                            continue
                        for d0 in window.loc[window[name] == 1, "date"]:
                            all_rows.append({"ticker": ticker, "date": d0, "scanner_label": name})
                    return all_rows
            """;

    static final String STUB_METHOD = """

                def {{method}}(self, *args, **kwargs):
                    \"""Placeholder added by self-correction.\"""
                    return args[0] if args else pd.DataFrame()
            """;

    private SkeletonTemplates() {
    }
}
