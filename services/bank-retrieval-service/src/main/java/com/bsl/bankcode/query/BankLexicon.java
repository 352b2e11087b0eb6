package com.bsl.bankcode.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static vocabulary shared by query extraction and record keyword indexing.
 */
public final class BankLexicon {

    public static final List<String> CORPORATE_MARKERS = List.of("股份有限公司", "有限责任公司", "有限公司");

    public static final List<String> BRANCH_SUFFIXES = List.of("支行", "分行", "营业部", "营业厅", "分理处", "储蓄所", "网点");

    public static final List<String> BRANCH_TYPES = List.of(
        "支行", "分行", "分理处", "储蓄所", "营业部", "营业厅", "网点",
        "分支机构", "办事处", "代理点", "服务点", "自助银行", "便民服务点"
    );

    public static final List<String> SPECIAL_AREAS = List.of(
        "开发区", "高新区", "经济开发区", "技术开发区", "工业园区", "科技园", "保税区", "自贸区",
        "新区", "示范区", "试验区", "CBD", "商务区", "金融区", "商业区", "购物中心", "广场", "大厦",
        "中心", "机场", "火车站", "高铁站", "地铁站", "汽车站", "港口", "码头"
    );

    public static final List<String> CITIES = longestFirst(List.of(
        "北京", "上海", "天津", "重庆",
        "石家庄", "太原", "呼和浩特", "沈阳", "长春", "哈尔滨", "南京", "杭州", "合肥", "福州", "南昌",
        "济南", "郑州", "武汉", "长沙", "广州", "南宁", "海口", "成都", "贵阳", "昆明", "拉萨", "西安",
        "兰州", "西宁", "银川", "乌鲁木齐", "厦门", "深圳", "青岛", "大连", "宁波",
        "苏州", "无锡", "常州", "温州", "嘉兴", "湖州", "绍兴", "金华", "衢州", "舟山", "台州", "丽水",
        "芜湖", "蚌埠", "淮南", "马鞍山", "淮北", "铜陵", "安庆", "黄山", "滁州", "阜阳", "宿州", "六安",
        "亳州", "池州", "宣城", "莆田", "三明", "泉州", "漳州", "南平", "龙岩", "宁德", "景德镇", "萍乡",
        "九江", "新余", "鹰潭", "赣州", "吉安", "宜春", "抚州", "上饶", "淄博", "枣庄", "东营", "烟台",
        "潍坊", "济宁", "泰安", "威海", "日照", "临沂", "德州", "聊城", "滨州", "菏泽", "开封", "洛阳",
        "平顶山", "安阳", "鹤壁", "新乡", "焦作", "濮阳", "许昌", "漯河", "三门峡", "南阳", "商丘", "信阳",
        "周口", "驻马店", "黄石", "十堰", "宜昌", "襄阳", "鄂州", "荆门", "孝感", "荆州", "黄冈", "咸宁",
        "随州", "恩施", "株洲", "湘潭", "衡阳", "邵阳", "岳阳", "常德", "张家界", "益阳", "郴州", "永州",
        "怀化", "娄底", "韶关", "珠海", "汕头", "佛山", "江门", "湛江", "茂名", "肇庆", "惠州", "梅州",
        "汕尾", "河源", "阳江", "清远", "东莞", "中山", "潮州", "揭阳", "云浮", "柳州", "桂林", "梧州",
        "北海", "防城港", "钦州", "贵港", "玉林", "百色", "贺州", "河池", "来宾", "崇左", "三亚", "儋州",
        "自贡", "攀枝花", "泸州", "德阳", "绵阳", "广元", "遂宁", "内江", "乐山", "南充", "眉山", "宜宾",
        "广安", "达州", "雅安", "巴中", "资阳", "遵义", "安顺", "毕节", "铜仁", "曲靖", "玉溪", "保山",
        "昭通", "丽江", "普洱", "临沧", "日喀则", "林芝", "铜川", "宝鸡", "咸阳", "渭南", "延安", "汉中",
        "榆林", "安康", "商洛", "嘉峪关", "金昌", "白银", "天水", "武威", "张掖", "平凉", "酒泉", "庆阳",
        "定西", "陇南", "石嘴山", "吴忠", "固原", "中卫", "克拉玛依", "吐鲁番", "哈密"
    ));

    public static final List<String> COMMERCIAL_AREAS = longestFirst(List.of(
        "西单", "王府井", "中关村", "国贸", "金融街", "望京", "三里屯", "朝阳门", "建国门", "复兴门",
        "西直门", "东直门", "安定门", "崇文门", "宣武门", "阜成门", "德胜门", "和平门", "前门", "雍和宫",
        "陆家嘴", "外滩", "南京路", "淮海路", "徐家汇", "人民广场", "静安寺", "虹桥", "浦东", "黄浦",
        "长宁", "普陀", "虹口", "杨浦", "闵行", "宝山", "嘉定", "松江", "青浦", "奉贤", "崇明",
        "天河", "越秀", "荔湾", "海珠", "白云", "番禺", "花都", "南沙", "增城", "珠江新城", "五羊新城",
        "福田", "罗湖", "南山", "宝安", "龙岗", "盐田", "龙华", "坪山", "华强北", "蛇口", "前海"
    ));

    /**
     * Districts well known enough to stand in for a location when no city is named.
     */
    public static final Set<String> LANDMARK_AREAS = Set.of("西单", "王府井", "中关村", "国贸", "金融街", "陆家嘴", "外滩");

    public static final List<String> STOPWORDS = longestFirst(List.of(
        "联行号", "行号", "清算号", "清算代码", "号码", "代码", "编号", "查一下", "查询", "请问", "帮我",
        "什么", "多少", "哪个", "哪里", "怎么", "一下", "是", "的", "吗", "呢", "请", "查", "在"
    ));

    public static final Set<String> LATIN_STOPWORDS = Set.of(
        "the", "of", "what", "is", "for", "code", "bank", "branch", "please", "a", "an"
    );

    private static final List<Brand> BRANDS = List.of(
        brand("中国工商银行", List.of("工商银行", "工行", "ICBC"), List.of("中国工商", "工商", "工商行")),
        brand("中国农业银行", List.of("农业银行", "农行", "ABC"), List.of("中国农业", "农业")),
        brand("中国银行", List.of("中行", "BOC"), List.of("中银")),
        brand("中国建设银行", List.of("建设银行", "建行", "CCB"), List.of("中国建设", "建设")),
        brand("交通银行", List.of("交行", "BOCOM"), List.of("交通", "交银")),
        brand("中国邮政储蓄银行", List.of("邮政储蓄银行", "邮储银行", "邮政银行", "邮政储蓄", "邮储", "PSBC"), List.of("邮政")),
        brand("招商银行", List.of("招行", "CMB"), List.of("招商", "招银")),
        brand("上海浦东发展银行", List.of("浦发银行", "浦东发展银行", "SPDB"), List.of("浦东发展", "浦发")),
        brand("中信银行", List.of("中信", "CITIC"), List.of("中信行")),
        brand("中国光大银行", List.of("光大银行", "光大", "CEB"), List.of("光大行")),
        brand("华夏银行", List.of("华夏", "HXB"), List.of("华夏行")),
        brand("中国民生银行", List.of("民生银行", "民生", "CMBC"), List.of("民生行")),
        brand("广发银行", List.of("广东发展银行", "广发", "CGB"), List.of("广东发展", "广发行")),
        brand("平安银行", List.of("平安", "PAB"), List.of("平安行")),
        brand("兴业银行", List.of("兴业", "CIB"), List.of("兴业行")),
        brand("北京银行", List.of("BOB"), List.of("北京行", "京行")),
        brand("上海银行", List.of("BOS"), List.of("上海行", "沪行")),
        brand("江苏银行", List.of(), List.of("江苏行", "苏行")),
        brand("浙商银行", List.of("浙商"), List.of("浙商行")),
        brand("渤海银行", List.of("渤海"), List.of("渤海行")),
        brand("恒丰银行", List.of("恒丰"), List.of("恒丰行")),
        brand("南京银行", List.of(), List.of("南京行", "宁行")),
        brand("宁波银行", List.of(), List.of("宁波行", "甬行")),
        brand("杭州银行", List.of(), List.of("杭州行", "杭行")),
        brand("徽商银行", List.of(), List.of("徽商", "徽商行")),
        brand("长沙银行", List.of(), List.of("长沙行")),
        brand("郑州银行", List.of(), List.of("郑州行")),
        brand("青岛银行", List.of(), List.of("青岛行")),
        brand("大连银行", List.of(), List.of("大连行")),
        brand("哈尔滨银行", List.of(), List.of("哈尔滨行")),
        brand("盛京银行", List.of(), List.of("盛京")),
        brand("锦州银行", List.of(), List.of("锦州行")),
        brand("北京农商银行", List.of("北京农村商业银行", "北京农商"), List.of("京农商")),
        brand("上海农商银行", List.of("上海农村商业银行", "上海农商"), List.of("沪农商")),
        brand("重庆农商银行", List.of("重庆农村商业银行", "重庆农商"), List.of("渝农商")),
        brand("广州农商银行", List.of("广州农村商业银行", "广州农商"), List.of("穗农商")),
        brand("深圳农商银行", List.of("深圳农村商业银行", "深圳农商"), List.of("深农商")),
        brand("东亚银行", List.of("BEA"), List.of("东亚")),
        brand("花旗银行", List.of("花旗", "Citibank"), List.of()),
        brand("汇丰银行", List.of("汇丰", "HSBC"), List.of()),
        brand("渣打银行", List.of("渣打"), List.of("Standard Chartered")),
        brand("星展银行", List.of("星展", "DBS"), List.of()),
        brand("国家开发银行", List.of("国开行", "CDB"), List.of("国家开发")),
        brand("中国进出口银行", List.of("进出口银行", "EXIM"), List.of("进出口行")),
        brand("中国农业发展银行", List.of("农业发展银行", "农发行", "ADBC"), List.of())
    );

    private static final Map<String, Brand> QUERY_ALIASES;
    private static final List<String> QUERY_ALIASES_LONGEST_FIRST;

    static {
        Map<String, Brand> aliases = new LinkedHashMap<>();
        for (Brand brand : BRANDS) {
            aliases.putIfAbsent(brand.getCanonical(), brand);
            for (String alias : brand.getQueryAliases()) {
                aliases.putIfAbsent(alias, brand);
            }
        }
        QUERY_ALIASES = Collections.unmodifiableMap(aliases);
        QUERY_ALIASES_LONGEST_FIRST = longestFirst(new ArrayList<>(aliases.keySet()));
    }

    private BankLexicon() {
    }

    public static List<Brand> brands() {
        return BRANDS;
    }

    /**
     * Every alias usable in a query, including canonical names, longest first.
     */
    public static List<String> queryAliases() {
        return QUERY_ALIASES_LONGEST_FIRST;
    }

    public static Brand brandForAlias(String alias) {
        return QUERY_ALIASES.get(alias);
    }

    /**
     * Brand whose canonical name, or a full-form alias ending in 银行, appears in the bank name.
     */
    public static Brand brandOfBankName(String bankName) {
        if (bankName == null || bankName.isEmpty()) {
            return null;
        }
        Brand best = null;
        int bestLength = 0;
        for (Brand brand : BRANDS) {
            for (String form : brand.fullForms()) {
                if (form.length() > bestLength && bankName.contains(form)) {
                    best = brand;
                    bestLength = form.length();
                }
            }
        }
        return best;
    }

    public static boolean isLatin(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c > 0x7F) {
                return false;
            }
        }
        return true;
    }

    private static Brand brand(String canonical, List<String> queryAliases, List<String> indexAliases) {
        return new Brand(canonical, queryAliases, indexAliases);
    }

    private static List<String> longestFirst(List<String> values) {
        List<String> sorted = new ArrayList<>(new LinkedHashSet<>(values));
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return Collections.unmodifiableList(sorted);
    }

    public static final class Brand {
        private final String canonical;
        private final List<String> queryAliases;
        private final List<String> indexAliases;

        private Brand(String canonical, List<String> queryAliases, List<String> indexAliases) {
            this.canonical = canonical;
            this.queryAliases = List.copyOf(queryAliases);
            this.indexAliases = List.copyOf(indexAliases);
        }

        public String getCanonical() {
            return canonical;
        }

        public List<String> getQueryAliases() {
            return queryAliases;
        }

        public List<String> getIndexAliases() {
            return indexAliases;
        }

        /**
         * Canonical name plus every alias, in lexicon order.
         */
        public List<String> allNames() {
            List<String> names = new ArrayList<>();
            names.add(canonical);
            names.addAll(queryAliases);
            names.addAll(indexAliases);
            return names;
        }

        List<String> fullForms() {
            List<String> forms = new ArrayList<>();
            forms.add(canonical);
            for (String alias : queryAliases) {
                if (alias.endsWith("银行") || alias.toLowerCase(Locale.ROOT).endsWith("bank")) {
                    forms.add(alias);
                }
            }
            return forms;
        }
    }
}
